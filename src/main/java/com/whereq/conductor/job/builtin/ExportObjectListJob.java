package com.whereq.conductor.job.builtin;

import com.whereq.conductor.job.Job;
import com.whereq.conductor.job.JobContext;
import com.whereq.conductor.job.JobMeta;
import com.whereq.conductor.model.JobVariable;
import com.whereq.conductor.model.TypedArgs;
import com.whereq.conductor.model.VariableType;
import com.whereq.conductor.registry.RecordStoreClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Exports every record of one type from the record store as CSV, optionally filtered by
 * {@code field=value} pairs
 */
@Component
@RequiredArgsConstructor
public class ExportObjectListJob implements Job {

    public static final String ID = "ExportObjectList";

    static final String CONTENT_TYPE = "content_type";
    static final String QUERY_STRING = "query_string";

    private static final Duration RECORD_STORE_TIMEOUT = Duration.ofMinutes(5);

    private final RecordStoreClient recordStoreClient;

    @Override
    public JobMeta meta() {
        return JobMeta.builder()
            .id(ID)
            .name("Export Object List")
            .description("Export a list of objects of one type as CSV")
            .variables(List.of(
                JobVariable.builder()
                    .name(CONTENT_TYPE)
                    .type(VariableType.STRING)
                    .label("Content Type")
                    .description("Type of objects to export, e.g. dcim.device")
                    .regex("[a-z_]+\\.[a-z_]+")
                    .build(),
                JobVariable.builder()
                    .name(QUERY_STRING)
                    .type(VariableType.STRING)
                    .label("Filter Parameters")
                    .description("Filters in URL query format, e.g. status=active&site=ams1")
                    .required(false)
                    .build()))
            .readOnly(true)
            .softTimeLimit(Duration.ofSeconds(1800))
            .timeLimit(Duration.ofSeconds(2000))
            .build();
    }

    @Override
    public Object run(JobContext context, TypedArgs args) {
        String type = args.getString(CONTENT_TYPE);
        Map<String, String> filters = parseQuery(args.getString(QUERY_STRING));
        context.getLogger().debug("Filter parameters: " + filters);

        List<Map<String, Object>> records = recordStoreClient.list(type)
            .filter(record -> matches(record, filters))
            .collectList()
            .block(RECORD_STORE_TIMEOUT);
        if (records == null) {
            records = List.of();
        }
        context.getLogger().info("Exporting " + records.size() + " " + type + " object(s) to CSV");

        String csv = toCsv(records);
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("filename", type.substring(type.indexOf('.') + 1) + "s.csv");
        output.put("content_type", "text/csv");
        output.put("row_count", records.size());
        output.put("content", csv);
        context.getLogger().success("Exported " + records.size() + " object(s)");
        return output;
    }

    static Map<String, String> parseQuery(String query) {
        Map<String, String> filters = new LinkedHashMap<>();
        if (query == null || query.isBlank()) {
            return filters;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Invalid filter '" + pair + "', expected field=value");
            }
            filters.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
        }
        return filters;
    }

    private static boolean matches(Map<String, Object> record, Map<String, String> filters) {
        return filters.entrySet().stream()
            .allMatch(filter -> filter.getValue().equals(String.valueOf(record.get(filter.getKey()))));
    }

    static String toCsv(List<Map<String, Object>> records) {
        Set<String> columns = new LinkedHashSet<>();
        records.forEach(record -> columns.addAll(record.keySet()));
        List<String> header = new ArrayList<>(columns);

        StringBuilder csv = new StringBuilder();
        csv.append(header.stream().map(ExportObjectListJob::escape).collect(Collectors.joining(","))).append('\n');
        for (Map<String, Object> record : records) {
            csv.append(header.stream()
                    .map(column -> escape(record.get(column) == null ? "" : String.valueOf(record.get(column))))
                    .collect(Collectors.joining(",")))
                .append('\n');
        }
        return csv.toString();
    }

    private static String escape(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
