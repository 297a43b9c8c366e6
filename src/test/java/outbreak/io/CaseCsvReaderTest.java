package outbreak.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import outbreak.ConfigurationException;
import outbreak.data.CaseRecord;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Line-list CSV ingestion")
class CaseCsvReaderTest {

    private static final List<String> LINES = List.of(
        "id,surname,state,report_date,age,cholera,measles,malaria",
        "1,Okafor,Lagos,2018-03-05,34,1,0,0",
        "2,\"Bello, Jr\",Kano,2018-03-06 14:30:00,7,0,1,1",
        "3,Ade,Oyo,not-a-date,12,1,0,0",
        "",
        "4,Musa,Kano,2018-03-12,41,abc,2,0");

    @Test
    @DisplayName("One record per known disease column, invalid dates dropped")
    void testParse() {
        List<CaseRecord> records = new CaseCsvReader().parse(LINES);

        assertEquals(9, records.size(), "three valid rows x three disease columns");
        assertEquals(new CaseRecord("Lagos", LocalDate.of(2018, 3, 5), "cholera", 1), records.get(0));
        assertEquals(new CaseRecord("Kano", LocalDate.of(2018, 3, 6), "measles", 1), records.get(4));
        assertTrue(records.stream().noneMatch(r -> r.getEntity().equals("Oyo")));
        assertEquals(0, records.get(6).getCount(), "unparseable count repaired to zero");
    }

    @Test
    @DisplayName("Explicit disease list must exist in the header")
    void testExplicitDiseases() {
        CaseCsvReader reader = new CaseCsvReader("state", "report_date", List.of("malaria"));
        List<CaseRecord> records = reader.parse(LINES);
        assertEquals(3, records.size());
        assertTrue(records.stream().allMatch(r -> r.getDisease().equals("malaria")));

        CaseCsvReader missing = new CaseCsvReader("state", "report_date", List.of("ebola"));
        assertThrows(ConfigurationException.class, () -> missing.parse(LINES));
    }

    @Test
    void testMissingEntityColumn() {
        assertThrows(ConfigurationException.class,
            () -> new CaseCsvReader().parse(List.of("region,report_date,cholera", "Lagos,2018-01-01,1")));
    }

    @Test
    void testSplitQuoted() {
        assertEquals(List.of("a", "b, c", "d\"e", ""), CaseCsvReader.splitLine("a,\"b, c\",\"d\"\"e\","));
    }
}
