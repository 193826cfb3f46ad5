package io.chatflow.core.template;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Regex-based `{{name}}` resolver with dotted-path lookup.
///
/// `{{ node1.body.items.0.title }}` walks map keys and list indices. Whitespace
/// inside the braces is ignored. A placeholder that cannot be resolved is left
/// in the output unchanged.
///
/// @implNote Stateless and thread-safe.
public class SimpleTemplateResolver implements TemplateResolver {

    private static final Logger logger = Logger.getLogger(SimpleTemplateResolver.class.getName());
    private static final Pattern TEMPLATE_PATTERN = Pattern.compile("\\{\\{([^}]+)}}");

    @Override
    public String resolve(String template, Map<String, Object> variables) {
        if (template == null) {
            return "";
        }

        Matcher matcher = TEMPLATE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String name = matcher.group(1).trim();
            Optional<Object> value = lookup(name, variables);
            String replacement;
            if (value.isPresent()) {
                replacement = String.valueOf(value.get());
            } else {
                logger.warning("Unresolved template variable: " + name);
                replacement = matcher.group();
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    @Override
    public List<String> extractVariables(String template) {
        if (template == null) {
            return List.of();
        }
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = TEMPLATE_PATTERN.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1).trim());
        }
        return new ArrayList<>(names);
    }

    private static Optional<Object> lookup(String name, Map<String, Object> variables) {
        if (variables.containsKey(name)) {
            return Optional.ofNullable(variables.get(name));
        }

        String[] parts = name.split("\\.");
        if (!variables.containsKey(parts[0])) {
            return Optional.empty();
        }

        Object current = variables.get(parts[0]);
        for (int i = 1; i < parts.length && current != null; i++) {
            current = step(current, parts[i]);
        }
        return Optional.ofNullable(current);
    }

    private static Object step(Object current, String segment) {
        if (current instanceof Map<?, ?> map) {
            return map.get(segment);
        }
        if (current instanceof List<?> list) {
            try {
                int index = Integer.parseInt(segment);
                return index >= 0 && index < list.size() ? list.get(index) : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
