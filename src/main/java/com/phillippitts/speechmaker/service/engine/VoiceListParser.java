package com.phillippitts.speechmaker.service.engine;

import com.phillippitts.speechmaker.domain.Voice;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code edge-tts --list-voices} output.
 *
 * <p>Accepts the key/value layout (one {@code Name: ...} entry per line or per block, with optional
 * {@code Gender:} and {@code Language:}/{@code Locale:} fields) and the tabular layout printed by
 * newer engine versions ({@code Name  Gender  ContentCategories  VoicePersonalities} header, a dashed
 * rule, then one row per voice). Malformed lines are skipped; duplicate ids keep the first entry.
 */
final class VoiceListParser {

    private static final Pattern NAME = Pattern.compile("Name:\\s*([^,]+)");
    private static final Pattern GENDER = Pattern.compile("Gender:\\s*([^,]+)");
    private static final Pattern LANGUAGE = Pattern.compile("(?:Language|Locale):\\s*([^,\\s]+)");
    private static final Pattern ID_LOCALE = Pattern.compile("^([a-z]{2,3}-[A-Za-z]{2,4})-(.+)$");
    private static final Pattern TABLE_HEADER = Pattern.compile("^Name\\s+Gender\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private VoiceListParser() {
    }

    static List<Voice> parse(String output) {
        if (output == null || output.isBlank()) {
            return List.of();
        }
        Map<String, Voice> voices = new LinkedHashMap<>();
        Entry current = null;
        boolean table = false;

        for (String raw : output.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (TABLE_HEADER.matcher(line).find()) {
                table = true;
                continue;
            }
            if (table) {
                if (!line.startsWith("-")) {
                    addTableRow(line, voices);
                }
                continue;
            }

            Matcher name = NAME.matcher(line);
            if (name.find()) {
                add(current, voices);
                current = new Entry(name.group(1).strip());
            }
            if (current == null) {
                continue;
            }
            Matcher gender = GENDER.matcher(line);
            if (gender.find()) {
                current.gender = gender.group(1).strip();
            }
            Matcher language = LANGUAGE.matcher(line);
            if (language.find()) {
                current.locale = language.group(1).strip();
            }
        }
        add(current, voices);
        return new ArrayList<>(voices.values());
    }

    private static void addTableRow(String line, Map<String, Voice> voices) {
        String[] cols = WHITESPACE.split(line, 3);
        if (cols.length < 2) {
            return;
        }
        Entry entry = new Entry(cols[0]);
        entry.gender = cols[1];
        add(entry, voices);
    }

    private static void add(Entry entry, Map<String, Voice> voices) {
        if (entry == null || entry.id.isEmpty()) {
            return;
        }
        Matcher m = ID_LOCALE.matcher(entry.id);
        String locale = entry.locale;
        String shortName = entry.id;
        if (m.matches()) {
            if (locale == null) {
                locale = m.group(1);
            }
            shortName = m.group(2);
        }
        if (shortName.endsWith("Neural") && shortName.length() > "Neural".length()) {
            shortName = shortName.substring(0, shortName.length() - "Neural".length());
        }
        String display = locale == null || locale.isEmpty() ? shortName : shortName + " (" + locale + ")";
        voices.putIfAbsent(entry.id, new Voice(entry.id, display, locale, entry.gender));
    }

    private static final class Entry {
        private final String id;
        private String gender;
        private String locale;

        private Entry(String id) {
            this.id = id;
        }
    }
}
