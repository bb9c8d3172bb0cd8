package com.whereq.conductor.job.builtin;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExportObjectListJobTest {

    @Test
    void shouldParseFilterQuery() {
        assertThat(ExportObjectListJob.parseQuery("status=active& site = ams1"))
            .containsExactly(Map.entry("status", "active"), Map.entry("site", "ams1"));
        assertThat(ExportObjectListJob.parseQuery(null)).isEmpty();
        assertThatThrownBy(() -> ExportObjectListJob.parseQuery("status"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldWriteUnionOfColumnsAndQuoteSpecialValues() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("id", 1);
        first.put("name", "core, rack 1");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("id", 2);
        second.put("comment", "say \"hi\"");

        assertThat(ExportObjectListJob.toCsv(List.of(first, second)))
            .isEqualTo("id,name,comment\n1,\"core, rack 1\",\n2,,\"say \"\"hi\"\"\"\n");
    }
}
