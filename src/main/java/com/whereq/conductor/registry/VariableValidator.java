package com.whereq.conductor.registry;

import com.whereq.conductor.exception.ValidationException;
import com.whereq.conductor.model.JobDefinition;
import com.whereq.conductor.model.JobVariable;
import com.whereq.conductor.model.ObjectRef;
import com.whereq.conductor.model.TypedArgs;
import com.whereq.conductor.store.FileProxyStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Checks raw job inputs against the declared variables and normalizes them to their
 * JSON-friendly typed form. All problems are reported together in one ValidationException.
 */
@Component
@RequiredArgsConstructor
public class VariableValidator {

    private static final Pattern IPV4 = Pattern.compile(
        "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");

    private final RecordStoreClient recordStoreClient;
    private final FileProxyStore fileProxyStore;

    public Mono<TypedArgs> validate(JobDefinition definition, Map<String, Object> raw) {
        Map<String, Object> input = raw == null ? Map.of() : raw;
        List<String> errors = new ArrayList<>();
        Map<String, Object> values = new LinkedHashMap<>();
        List<ObjectRef> refs = new ArrayList<>();
        List<String> files = new ArrayList<>();

        Set<String> declared = definition.getVariables().stream()
            .map(JobVariable::getName)
            .collect(Collectors.toSet());
        input.keySet().stream()
            .filter(key -> !declared.contains(key) && !TypedArgs.DRYRUN.equals(key))
            .sorted()
            .forEach(key -> errors.add("Unknown input '" + key + "'"));

        for (JobVariable variable : definition.getVariables()) {
            Object value = input.get(variable.getName());
            if (isBlank(value)) {
                value = variable.getDefaultValue();
            }
            if (isBlank(value)) {
                if (variable.isRequired()) {
                    errors.add("Missing required input '" + variable.getName() + "'");
                }
                continue;
            }
            try {
                Object normalized = normalize(variable, value, refs, files);
                values.put(variable.getName(), normalized);
            } catch (IllegalArgumentException e) {
                errors.add("Input '" + variable.getName() + "': " + e.getMessage());
            }
        }

        Object dryrun = input.get(TypedArgs.DRYRUN);
        values.put(TypedArgs.DRYRUN, dryrun == null
            ? definition.isDryrunDefault()
            : Boolean.parseBoolean(dryrun.toString()));

        if (!errors.isEmpty()) {
            return Mono.error(new ValidationException(
                "Invalid inputs for job '" + definition.getId() + "': " + String.join("; ", errors)));
        }

        return checkReferences(refs, files)
            .collectList()
            .flatMap(missing -> {
                if (!missing.isEmpty()) {
                    return Mono.error(new ValidationException(
                        "Invalid inputs for job '" + definition.getId() + "': " + String.join("; ", missing)));
                }
                return Mono.just(new TypedArgs(values));
            });
    }

    private Flux<String> checkReferences(List<ObjectRef> refs, List<String> files) {
        Flux<String> missingObjects = Flux.fromIterable(refs)
            .concatMap(ref -> recordStoreClient.exists(ref)
                .filter(exists -> !exists)
                .map(exists -> "Object not found: " + ref));
        Flux<String> missingFiles = Flux.fromIterable(files)
            .concatMap(id -> fileProxyStore.find(id)
                .map(file -> "")
                .defaultIfEmpty("File not found or expired: " + id))
            .filter(message -> !message.isEmpty());
        return Flux.concat(missingObjects, missingFiles);
    }

    private Object normalize(JobVariable variable, Object value, List<ObjectRef> refs, List<String> files) {
        return switch (variable.getType()) {
            case STRING -> string(variable, value);
            case INTEGER -> integer(variable, value);
            case BOOLEAN -> bool(value);
            case CHOICE -> choice(variable, value);
            case OBJECT -> {
                ObjectRef ref = objectRef(variable, value);
                refs.add(ref);
                yield refMap(ref);
            }
            case MULTI_OBJECT -> {
                if (!(value instanceof Collection<?> items)) {
                    throw new IllegalArgumentException("expected a list of object references");
                }
                List<Map<String, Object>> normalized = new ArrayList<>();
                for (Object item : items) {
                    ObjectRef ref = objectRef(variable, item);
                    refs.add(ref);
                    normalized.add(refMap(ref));
                }
                yield normalized;
            }
            case FILE -> {
                String id = value.toString();
                files.add(id);
                yield id;
            }
            case IP_ADDRESS -> ipAddress(value.toString());
            case NETWORK -> network(value.toString());
        };
    }

    private String string(JobVariable variable, Object value) {
        String text = value.toString();
        if (variable.getMinLength() != null && text.length() < variable.getMinLength()) {
            throw new IllegalArgumentException("shorter than " + variable.getMinLength() + " characters");
        }
        if (variable.getMaxLength() != null && text.length() > variable.getMaxLength()) {
            throw new IllegalArgumentException("longer than " + variable.getMaxLength() + " characters");
        }
        if (variable.getRegex() != null && !Pattern.compile(variable.getRegex()).matcher(text).matches()) {
            throw new IllegalArgumentException("does not match " + variable.getRegex());
        }
        return text;
    }

    private Long integer(JobVariable variable, Object value) {
        long number;
        if (value instanceof Number n) {
            number = n.longValue();
        } else {
            try {
                number = Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("not an integer: " + value);
            }
        }
        if (variable.getMinValue() != null && number < variable.getMinValue()) {
            throw new IllegalArgumentException("less than " + variable.getMinValue());
        }
        if (variable.getMaxValue() != null && number > variable.getMaxValue()) {
            throw new IllegalArgumentException("greater than " + variable.getMaxValue());
        }
        return number;
    }

    private Boolean bool(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        String text = value.toString().trim().toLowerCase();
        return switch (text) {
            case "true", "on", "1", "yes" -> true;
            case "false", "off", "0", "no" -> false;
            default -> throw new IllegalArgumentException("not a boolean: " + value);
        };
    }

    private String choice(JobVariable variable, Object value) {
        String text = value.toString();
        if (variable.getChoices() == null || !variable.getChoices().contains(text)) {
            throw new IllegalArgumentException("'" + text + "' is not one of " + variable.getChoices());
        }
        return text;
    }

    private ObjectRef objectRef(JobVariable variable, Object value) {
        String type = variable.getObjectType();
        String id;
        if (value instanceof Map<?, ?> map) {
            Object rawType = map.get("type");
            Object rawId = map.get("id");
            if (rawId == null) {
                throw new IllegalArgumentException("object reference without id");
            }
            if (rawType != null) {
                if (type != null && !type.equals(rawType.toString())) {
                    throw new IllegalArgumentException("expected a " + type + " reference, got " + rawType);
                }
                type = rawType.toString();
            }
            id = rawId.toString();
        } else {
            id = value.toString();
        }
        if (type == null) {
            throw new IllegalArgumentException("object reference without type");
        }
        return new ObjectRef(type, id);
    }

    private static Map<String, Object> refMap(ObjectRef ref) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", ref.getType());
        map.put("id", ref.getId());
        return map;
    }

    private String ipAddress(String text) {
        String value = text.trim();
        if (IPV4.matcher(value).matches()) {
            return value;
        }
        if (value.contains(":") && value.matches("[0-9A-Fa-f:.]+")) {
            try {
                return InetAddress.getByName(value).getHostAddress();
            } catch (UnknownHostException e) {
                throw new IllegalArgumentException("not an IP address: " + text);
            }
        }
        throw new IllegalArgumentException("not an IP address: " + text);
    }

    private String network(String text) {
        String[] parts = text.trim().split("/");
        if (parts.length != 2) {
            throw new IllegalArgumentException("not a network prefix: " + text);
        }
        String address = ipAddress(parts[0]);
        int maxPrefix = address.contains(":") ? 128 : 32;
        int prefix;
        try {
            prefix = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a network prefix: " + text);
        }
        if (prefix < 0 || prefix > maxPrefix) {
            throw new IllegalArgumentException("prefix length out of range: " + text);
        }
        return address + "/" + prefix;
    }

    private static boolean isBlank(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }
}
