package io.chatflow.core.template;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Resolves `{{name}}` placeholders against a variables map.
///
/// The contract is deliberately small: placeholders name a variable or a
/// dotted path into one. There are no expressions, filters or conditionals.
///
/// @see SimpleTemplateResolver
public interface TemplateResolver {

    /// Replaces every placeholder in `template` with its value.
    ///
    /// @param template the template text, may be null (resolves to an empty string)
    /// @param variables available values keyed by name, not null
    /// @return the rendered text, never null
    String resolve(String template, Map<String, Object> variables);

    /// Returns the placeholder names used in a template, in order of appearance.
    ///
    /// @param template the template text, may be null
    /// @return distinct placeholder names, never null
    List<String> extractVariables(String template);

    /// Returns placeholder names whose root variable is not available.
    ///
    /// @param template the template text, may be null
    /// @param variables available values keyed by name, not null
    /// @return missing placeholder names in order of appearance, never null
    default List<String> findMissing(String template, Map<String, Object> variables) {
        List<String> missing = new ArrayList<>();
        for (String name : extractVariables(template)) {
            String root = name.contains(".") ? name.substring(0, name.indexOf('.')) : name;
            if (!variables.containsKey(name) && !variables.containsKey(root)) {
                missing.add(name);
            }
        }
        return missing;
    }

    /// Resolves templates nested anywhere inside maps and lists.
    ///
    /// Strings are resolved, maps and lists are copied with their elements
    /// resolved, and any other value is returned unchanged.
    ///
    /// @param value the value to resolve, may be null
    /// @param variables available values keyed by name, not null
    /// @return the resolved copy, or `value` itself for non-template values
    default Object resolveAll(Object value, Map<String, Object> variables) {
        if (value instanceof String text) {
            return resolve(text, variables);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            map.forEach((key, nested) -> resolved.put(String.valueOf(key), resolveAll(nested, variables)));
            return resolved;
        }
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            for (Object nested : list) {
                resolved.add(resolveAll(nested, variables));
            }
            return resolved;
        }
        return value;
    }
}
