package outbreak.cluster;

import outbreak.ConfigurationException;
import outbreak.InsufficientDataException;
import outbreak.data.BucketedSeries;
import outbreak.data.SeriesSlice;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces a bucketed table to one static vector per entity: the total count of each
 * disease across the observed window. A disease no entity reported is an all-zero column.
 */
public class ProfileBuilder {

    public EntityProfile build(BucketedSeries series, List<String> diseaseOrder) {
        if (new HashSet<>(diseaseOrder).size() != diseaseOrder.size()) {
            throw new ConfigurationException("disease ordering has duplicates: " + diseaseOrder);
        }
        if (series.entities().isEmpty()) {
            throw new InsufficientDataException("no entities to profile");
        }
        Map<String, double[]> vectors = new LinkedHashMap<>();
        for (String entity : series.entities()) {
            double[] v = new double[diseaseOrder.size()];
            for (SeriesSlice slice : series.slicesFor(entity)) {
                int col = diseaseOrder.indexOf(slice.getKey().getDisease());
                if (col >= 0) v[col] += slice.totalCount();
            }
            vectors.put(entity, v);
        }
        return new EntityProfile(diseaseOrder, vectors);
    }
}
