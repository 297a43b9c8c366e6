package outbreak;

public final class ClusterRow {

    private final String entity;
    private final int clusterId;

    public ClusterRow(String entity, int clusterId) {
        this.entity = entity;
        this.clusterId = clusterId;
    }

    public String getEntity() { return entity; }
    public int getClusterId() { return clusterId; }
}
