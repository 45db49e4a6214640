package domain.output;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArtifactNamePolicyTest {

    @Test
    void should_name_intermediates_after_table_and_column() {
        assertEquals("students-grade-idmap", ArtifactNamePolicy.idMapName("students", "grade"));
        assertEquals("students-grade-idsub", ArtifactNamePolicy.substitutionName("students", "grade"));
        assertEquals("students-grade-splice", ArtifactNamePolicy.spliceName("students", "grade"));
    }

    @Test
    void should_name_final_table_with_map_marker() {
        assertEquals("students-Map-GrGpRa", ArtifactNamePolicy.finalName("students", "GrGpRa"));
        assertEquals("students-Map-GrGpRa-report.xlsx", ArtifactNamePolicy.reportName("students-Map-GrGpRa"));
    }

    @Test
    void should_replace_unsafe_characters_and_tag_altered_names() {
        assertTrue(ArtifactNamePolicy.idMapName("my table", "unit/price")
                .matches("my_table_[0-9a-f]{8}-unit_price_[0-9a-f]{8}-idmap"));
        assertEquals("t-a_b_00017063-idsub", ArtifactNamePolicy.substitutionName("t", "a b"));
        assertTrue(ArtifactNamePolicy.spliceName(".hidden", "c").startsWith("_hidden_"));
        assertTrue(ArtifactNamePolicy.substitutionName("CON", "c").startsWith("_CON_"));
    }

    @Test
    void distinct_columns_should_never_share_a_name() {
        Set<String> names = new HashSet<>();
        for (String c : List.of("a b", "a_b", "a?b", " a_b", "a_b ")) {
            assertTrue(names.add(ArtifactNamePolicy.idMapName("t", c)), "collision for '" + c + "': " + names);
        }
        assertEquals("t-a_b-idmap", ArtifactNamePolicy.idMapName("t", "a_b"));
    }

    @Test
    void table_name_should_drop_directory_and_extension() {
        assertEquals("students", ArtifactNamePolicy.tableNameOf("data/students.csv"));
        assertEquals("students.2024", ArtifactNamePolicy.tableNameOf("C:\\data\\students.2024.csv"));
        assertEquals(".env", ArtifactNamePolicy.tableNameOf(".env"));
    }
}
