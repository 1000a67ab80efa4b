package com.findinpath.hierarchy.jdbc;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ConnectionProviderTest {

    @Test
    public void missingClasspathResourceIsRejected() {
        var exception = assertThrows(IllegalArgumentException.class,
                () -> ConnectionProvider.fromClasspathResource("missing-datasource.properties"));

        assertThat(exception.getMessage(), containsString("missing-datasource.properties"));
    }
}
