package com.luanvv.olx.listing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

/**
 * Free-form "key / value" attributes from list items and definition lists.
 */
public class SpecAttributeParser {

    /**
     * @return attributes in document order; the first occurrence of a key wins
     */
    public Map<String, String> parse(Document doc) {
        Map<String, String> specs = new LinkedHashMap<>();
        for (Element li : doc.select("ul li, .ad-attributes li")) {
            List<String> fragments = fragments(li);
            if (fragments.size() >= 2) {
                put(specs, fragments.get(0), String.join(" ", fragments.subList(1, fragments.size())));
            }
        }
        for (Element dl : doc.select("dl")) {
            Elements dts = dl.select("dt");
            Elements dds = dl.select("dd");
            for (int i = 0; i < Math.min(dts.size(), dds.size()); i++) {
                put(specs, dts.get(i).text(), dds.get(i).text());
            }
        }
        return specs;
    }

    /** Lower-cased, with every run of non letters/digits collapsed to a single underscore. */
    public static String normalizeKey(String raw) {
        return raw.strip().toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]+", "_");
    }

    private void put(Map<String, String> specs, String rawKey, String rawValue) {
        String key = normalizeKey(rawKey);
        String value = rawValue.strip();
        if (!key.isEmpty() && !value.isEmpty()) {
            specs.putIfAbsent(key, value);
        }
    }

    // Innermost span/div texts, so nested wrappers do not repeat their children's text.
    private List<String> fragments(Element li) {
        List<String> out = new ArrayList<>();
        for (Element el : li.select("span, div")) {
            if (el.select("span, div").size() > 1) {
                continue;
            }
            String text = el.text().strip();
            if (!text.isEmpty()) {
                out.add(text);
            }
        }
        return out;
    }
}
