package io.issuebridge.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Set;

final class FetchModeTest {

    @Test
    void parsesCaseInsensitivelyAndDefaultsToSummary() {
        Assertions.assertEquals(FetchMode.DETAILS, FetchMode.fromString("Details"));
        Assertions.assertEquals(FetchMode.FULL, FetchMode.fromString(" FULL "));
        Assertions.assertEquals(FetchMode.SUMMARY, FetchMode.fromString(null));
        Assertions.assertEquals(FetchMode.SUMMARY, FetchMode.fromString(""));
        Assertions.assertThrows(IllegalArgumentException.class, () -> FetchMode.fromString("everything"));
    }

    @Test
    void fieldListsAreCumulative() {
        Assertions.assertEquals("key,summary,status,issuetype", FetchMode.SUMMARY.fieldsParam());
        Assertions.assertTrue(FetchMode.DETAILS.fields().containsAll(FetchMode.SUMMARY.fields()));
        Assertions.assertTrue(FetchMode.FULL.fields().containsAll(FetchMode.DETAILS.fields()));
        Assertions.assertTrue(FetchMode.FULL.fields().contains("transitions"));
        Assertions.assertFalse(FetchMode.DETAILS.fields().contains("comment"));
        Assertions.assertTrue(FetchMode.FULL.expandsTransitions());
        Assertions.assertFalse(FetchMode.DETAILS.expandsTransitions());
    }

    @Test
    void standardNamesIncludeIdentityFields() {
        Set<String> names = FetchMode.standardFieldNames();
        Assertions.assertTrue(names.contains("id"));
        Assertions.assertTrue(names.contains("self"));
        Assertions.assertTrue(names.contains("fixVersions"));
        Assertions.assertFalse(names.contains("customfield_10010"));
    }
}
