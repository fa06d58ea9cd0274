package com.cloudname.generator.naming.compose;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import com.cloudname.generator.naming.model.CharFilter;
import com.cloudname.generator.naming.model.NamePart;
import com.cloudname.generator.naming.model.ResourceTypeTemplate;

import lombok.NoArgsConstructor;

/**
 * Turns name parts into the final resource name for a template: character
 * filtering, delimiter joining and lowercase normalization.
 */
@NoArgsConstructor
public class NameComposer {

    /**
     * Filters and lowercases every part (and its full value) so that stripped
     * characters do not count toward the length budget.
     */
    public List<NamePart> prepare(List<NamePart> parts, ResourceTypeTemplate template) {
        CharFilter filter = template.getCharFilter();
        return parts.stream()
                .map(p -> NamePart.of(p.getRole(), normalize(p.getValue(), filter), normalize(p.getFullValue(), filter)))
                .toList();
    }

    /**
     * Length left for the parts once the delimiters between the non-empty ones are reserved.
     */
    public int budget(List<NamePart> parts, ResourceTypeTemplate template) {
        long nonEmpty = parts.stream().filter(p -> !p.isEmpty()).count();
        int delimiters = (int) Math.max(0, nonEmpty - 1) * template.getDelimiter().length();
        return Math.max(0, template.getMaxLength() - delimiters);
    }

    /**
     * Joins the non-empty parts with the template delimiter. The result is
     * lowercase, filtered and never longer than the template's max length.
     */
    public String compose(List<NamePart> parts, ResourceTypeTemplate template) {
        String joined = parts.stream()
                .map(NamePart::getValue)
                .filter(v -> !v.isEmpty())
                .collect(Collectors.joining(template.getDelimiter()));
        String name = normalize(joined, template.getCharFilter());
        return name.length() > template.getMaxLength() ? name.substring(0, template.getMaxLength()) : name;
    }

    /**
     * Removes every character the filter rejects.
     */
    public static String filter(String value, CharFilter filter) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (filter.allows(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String normalize(String value, CharFilter filter) {
        return filter(value, filter).toLowerCase(Locale.ROOT);
    }
}
