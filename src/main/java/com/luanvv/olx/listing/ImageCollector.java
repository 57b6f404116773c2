package com.luanvv.olx.listing;

import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

public class ImageCollector {

    public SortedSet<String> collect(Document doc) {
        SortedSet<String> urls = new TreeSet<>();
        for (Element img : doc.select("img")) {
            addIfHttp(urls, img.attr("src"));
            addIfHttp(urls, img.attr("data-src"));
            addSrcset(urls, img.attr("srcset"));
        }
        for (Element source : doc.select("source")) {
            addSrcset(urls, source.attr("srcset"));
        }
        return urls;
    }

    // "a.jpg 1x, b.jpg 2x": first token of every candidate
    private void addSrcset(Set<String> urls, String srcset) {
        if (srcset == null || srcset.isBlank()) {
            return;
        }
        for (String candidate : srcset.split(",")) {
            String trimmed = candidate.strip();
            if (!trimmed.isEmpty()) {
                addIfHttp(urls, trimmed.split("\\s+")[0]);
            }
        }
    }

    private void addIfHttp(Set<String> urls, String url) {
        String trimmed = url == null ? "" : url.strip();
        if (trimmed.startsWith("http")) {
            urls.add(trimmed);
        }
    }
}
