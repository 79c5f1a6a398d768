package com.luanvv.clearance.core;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

public class UrlUtils {

  public static final Map<String, String> REPLACEMENTS = Map.of(
      " ", "%20",
      "\\[", "%5B",
      "]", "%5D",
      "\\|", "%7C"
  );

  static final String DEFAULT_EXTENSION = ".jpg";
  private static final Pattern EXTENSION = Pattern.compile("\\.[A-Za-z0-9]{1,5}");
  private static final Pattern ILLEGAL_FILENAME_CHARS = Pattern.compile("[/\\\\?<>:*|\"\\x00-\\x1f\\x80-\\x9f]");

  private UrlUtils() {
  }

  /**
   * Resolves {@code href} against {@code baseUrl}. Empty when either side is unusable.
   */
  public static Optional<String> toAbsolute(String baseUrl, String href) {
    if (href == null || href.isBlank()) {
      return Optional.empty();
    }
    try {
      URI ref = new URI(urlEncode(href.trim()));
      if (ref.isAbsolute()) {
        return Optional.of(ref.toString());
      }
      if (baseUrl == null || baseUrl.isBlank()) {
        return Optional.empty();
      }
      return Optional.of(new URI(urlEncode(baseUrl)).resolve(ref).toString());
    } catch (URISyntaxException | IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  public static String urlEncode(String s) {
    for (Map.Entry<String, String> e : REPLACEMENTS.entrySet()) {
      s = s.replaceAll(e.getKey(), e.getValue());
    }
    return s;
  }

  /**
   * Sets {@code name=value} in the query string, replacing any existing occurrence.
   */
  public static String withQueryParam(String url, String name, String value) {
    URI uri = URI.create(url);
    List<String> params = new ArrayList<>();
    if (uri.getRawQuery() != null && !uri.getRawQuery().isEmpty()) {
      for (String pair : uri.getRawQuery().split("&")) {
        if (!pair.equals(name) && !pair.startsWith(name + "=")) {
          params.add(pair);
        }
      }
    }
    params.add(name + "=" + value);
    StringBuilder sb = new StringBuilder();
    sb.append(uri.getScheme()).append("://").append(uri.getRawAuthority());
    sb.append(uri.getRawPath() == null ? "" : uri.getRawPath());
    sb.append('?').append(String.join("&", params));
    if (uri.getRawFragment() != null) {
      sb.append('#').append(uri.getRawFragment());
    }
    return sb.toString();
  }

  public static boolean hasQueryParam(String url, String name) {
    try {
      String query = URI.create(url).getRawQuery();
      if (query == null) {
        return false;
      }
      for (String pair : query.split("&")) {
        if (pair.equals(name) || pair.startsWith(name + "=")) {
          return true;
        }
      }
      return false;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  /**
   * Extension of the last path segment including the dot, {@code .jpg} when there is none.
   */
  public static String fileExtension(String url) {
    try {
      String path = new URI(urlEncode(url)).getPath();
      if (path == null) {
        return DEFAULT_EXTENSION;
      }
      String segment = path.substring(path.lastIndexOf('/') + 1);
      int dot = segment.lastIndexOf('.');
      if (dot <= 0) {
        return DEFAULT_EXTENSION;
      }
      String ext = segment.substring(dot);
      return EXTENSION.matcher(ext).matches() ? ext.toLowerCase(Locale.ROOT) : DEFAULT_EXTENSION;
    } catch (URISyntaxException | IllegalArgumentException e) {
      return DEFAULT_EXTENSION;
    }
  }

  /**
   * Drops characters that are not allowed in file names on common file systems.
   */
  public static String sanitizeForFilename(String name) {
    String safe = ILLEGAL_FILENAME_CHARS.matcher(name).replaceAll("");
    safe = safe.replaceAll("^\\.+", "").replaceAll("[. ]+$", "");
    return safe;
  }
}
