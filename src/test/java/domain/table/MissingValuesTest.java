package domain.table;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MissingValuesTest {

    @Test
    void defaults_should_recognize_common_missing_tokens() {
        MissingValues mv = MissingValues.defaults();
        for (String s : List.of("", "NA", "N/A", "NaN", "nan", "null", "NULL", "None", "#N/A", "<NA>")) {
            assertTrue(mv.isMissing(s), "should be missing: '" + s + "'");
        }
        assertTrue(mv.isMissing(null));
        assertFalse(mv.isMissing("0"));
        assertFalse(mv.isMissing(" "));
        assertFalse(mv.isMissing("none"));
    }

    @Test
    void normalize_should_map_missing_to_null_and_keep_other_values() {
        MissingValues mv = MissingValues.defaults();
        assertNull(mv.normalize("NA"));
        assertEquals("A", mv.normalize("A"));
    }

    @Test
    void custom_tokens_should_replace_defaults_but_keep_empty_field() {
        MissingValues mv = MissingValues.of(List.of("-"));
        assertTrue(mv.isMissing("-"));
        assertTrue(mv.isMissing(""));
        assertFalse(mv.isMissing("NA"));
    }
}
