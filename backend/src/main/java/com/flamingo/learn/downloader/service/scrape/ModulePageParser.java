package com.flamingo.learn.downloader.service.scrape;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/** Reads unit links from module pages and learning path UIDs from course pages. */
@Component
public class ModulePageParser {

  /**
   * Reads the module page's unit table.
   *
   * @param moduleHtml module page markup
   * @param moduleUrl module page URL, relative links resolve against it
   * @return absolute unit URL keyed by unit UID, in page order
   */
  public Map<String, String> unitLinks(String moduleHtml, String moduleUrl) {
    String base = moduleUrl.split("\\?", 2)[0];
    if (!base.endsWith("/")) {
      base += "/";
    }
    Document document = Jsoup.parse(moduleHtml, base);
    Map<String, String> links = new LinkedHashMap<>();
    for (Element item : document.select("li.module-unit[data-unit-uid]")) {
      String uid = item.attr("data-unit-uid").trim();
      Element link = item.selectFirst("a.unit-title[href]");
      if (uid.isEmpty() || link == null) {
        continue;
      }
      String href = link.attr("href").trim();
      if (!href.isEmpty()) {
        links.put(uid, ContentExtractor.resolve(base, href));
      }
    }
    return links;
  }

  /**
   * Reads the learning path UIDs listed on a course page.
   *
   * @param courseHtml course page markup
   * @return UIDs in first-seen order without repeats
   */
  public List<String> courseLearningPathUids(String courseHtml) {
    Set<String> uids = new LinkedHashSet<>();
    for (Element article : Jsoup.parse(courseHtml).select("article[data-learn-uid]")) {
      String uid = article.attr("data-learn-uid").trim();
      if (!uid.isEmpty()) {
        uids.add(uid);
      }
    }
    return List.copyOf(uids);
  }
}
