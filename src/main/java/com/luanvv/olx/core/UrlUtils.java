package com.luanvv.olx.core;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class UrlUtils {

  private static final Pattern AD_ID = Pattern.compile("iid-(\\d+)");
  private static final Pattern PAGE_PARAM = Pattern.compile("([?&])page=\\d*(&|$)");

  private UrlUtils() {
  }

  public static String pageUrl(String seedUrl, int page) {
    Matcher existing = PAGE_PARAM.matcher(seedUrl);
    String stripped = existing.find()
        ? seedUrl.substring(0, existing.start()) + (existing.group(2).isEmpty() ? "" : existing.group(1))
            + seedUrl.substring(existing.end())
        : seedUrl;
    if (page <= 1) {
      return stripped;
    }
    return stripped + (stripped.contains("?") ? "&" : "?") + "page=" + page;
  }

  public static Optional<String> adIdFromLink(String link) {
    if (link == null) {
      return Optional.empty();
    }
    Matcher m = AD_ID.matcher(link);
    return m.find() ? Optional.of(m.group(1)) : Optional.empty();
  }
}
