package nl.nfi.probregex.common.ini;

import org.json.JSONArray;
import org.json.JSONException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.Files.readAllLines;

// minimal INI reader: [SECTION] headers, key = value pairs, '#' and ';' comments
public final class IniConfig {

    private final Map<String, Map<String, String>> sections;

    private IniConfig(final Map<String, Map<String, String>> sections) {
        this.sections = sections;
    }

    public boolean hasSection(final String section) {
        return sections.containsKey(section);
    }

    public boolean hasKey(final String section, final String key) {
        return sections.containsKey(section) && sections.get(section).containsKey(key);
    }

    public IniSection getSection(final String section) {
        if (!hasSection(section)) {
            throw new IllegalArgumentException("INI config does not contain given section: %s".formatted(section));
        }
        return IniSection.ofConfig(this, section);
    }

    public String getString(final String section, final String key) {
        if (!hasKey(section, key)) {
            throw new IllegalArgumentException("INI config does not contain key in given section: %s -> %s".formatted(section, key));
        }
        return sections.get(section).get(key);
    }

    public long getLong(final String section, final String key) {
        final String value = getString(section, key);
        try {
            return Long.parseLong(value);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("INI value is not an integer: %s -> %s = %s".formatted(section, key, value), e);
        }
    }

    public List<String> getStringList(final String section, final String key) {
        final String value = getString(section, key);
        try {
            final JSONArray array = new JSONArray(value);
            return array.toList().stream().map(String::valueOf).toList();
        } catch (final JSONException e) {
            throw new IllegalArgumentException("INI value is not a JSON array: %s -> %s = %s".formatted(section, key, value), e);
        }
    }

    public static IniConfig loadFrom(final Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("INI config file path does not exist: %s".formatted(path));
        }

        final Map<String, Map<String, String>> sections = new LinkedHashMap<>();

        Map<String, String> section = null;
        int lineNumber = 0;
        for (final String rawLine : readAllLines(path, UTF_8)) {
            lineNumber++;
            final String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                continue;
            }
            if (line.startsWith("[") && line.endsWith("]")) {
                section = sections.computeIfAbsent(line.substring(1, line.length() - 1).strip(), title -> new LinkedHashMap<>());
                continue;
            }
            if (section == null) {
                throw new IllegalArgumentException("INI entry outside of a section at %s:%d".formatted(path, lineNumber));
            }
            // split on the first '=' only, values may contain '=' themselves
            final int separator = line.indexOf('=');
            if (separator < 0) {
                section.put(line, "");
            } else {
                section.put(line.substring(0, separator).strip(), stripInlineComment(line.substring(separator + 1)).strip());
            }
        }
        return new IniConfig(sections);
    }

    // a '#' or ';' preceded by whitespace starts a comment, unless it is inside '...' or "..." quotes
    static String stripInlineComment(final String value) {
        char quote = 0;
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if ((c == '#' || c == ';') && (i == 0 || Character.isWhitespace(value.charAt(i - 1)))) {
                return value.substring(0, i);
            }
        }
        return value;
    }
}
