package com.flamingo.learn.downloader.service.scrape;

import com.flamingo.learn.downloader.domain.model.ImageRef;
import java.net.MalformedURLException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Extracts the main content region of a unit page, turns quiz forms into static markup, strips
 * page chrome and inventories the content images.
 */
@Component
@Slf4j
public class ContentExtractor {

  /** Most specific first. */
  static final List<String> CONTENT_SELECTORS =
      List.of(
          "main .content",
          "main article",
          "main [data-bi-name=content], main [role=main]",
          "article",
          "main");

  static final List<String> CHROME_SELECTORS =
      List.of(
          "nav",
          "header",
          "footer",
          ".nav",
          ".navigation",
          ".feedback",
          ".page-metadata",
          ".contributors",
          ".alert-banner",
          "[data-bi-name=feedback]",
          ".margin-note",
          ".is-invisible",
          "script",
          "style");

  private static final List<String> SOURCE_ATTRIBUTES = List.of("src", "data-src", "data-original");
  private static final List<String> NON_CONTENT_PATH_MARKERS =
      List.of("/achievements/", "/badges/");

  /**
   * Locates and cleans the main content region.
   *
   * @param html full page markup
   * @param baseUrl URL the page was fetched from
   * @return the cleaned region, empty when no selector matched
   */
  public Optional<Element> extractMainContent(String html, String baseUrl) {
    Document document = Jsoup.parse(html, baseUrl);
    for (String selector : CONTENT_SELECTORS) {
      Element content = document.selectFirst(selector);
      if (content != null) {
        normalizeQuiz(content);
        removeChrome(content);
        return Optional.of(content);
      }
    }
    log.debug("No main content region in page {}", baseUrl);
    return Optional.empty();
  }

  /**
   * Lists the content images of a region. Decorative images (presentation role without alt text)
   * and achievement badges are skipped.
   *
   * @param region content region
   * @param baseUrl page URL, used to absolutize sources and as the referer
   * @return images in document order
   */
  public List<ImageRef> extractImages(Element region, String baseUrl) {
    List<ImageRef> images = new ArrayList<>();
    for (Element img : region.select("img")) {
      String src = imageSource(img);
      if (src.isEmpty()) {
        continue;
      }
      String absoluteUrl = resolve(baseUrl, src);
      String role = img.attr("role").trim();
      String alt = img.attr("alt").trim();

      if (role.equalsIgnoreCase("presentation") && alt.isEmpty()) {
        continue;
      }
      String path = urlPath(absoluteUrl);
      if (NON_CONTENT_PATH_MARKERS.stream().anyMatch(path::contains)) {
        continue;
      }
      if (!alt.isEmpty() || role.isEmpty()) {
        images.add(
            new ImageRef(
                absoluteUrl,
                alt,
                dimension(img.attr("width")),
                dimension(img.attr("height")),
                src,
                baseUrl));
      }
    }
    return images;
  }

  /** Replaces the interactive quiz form with headings and choice lists. */
  void normalizeQuiz(Element content) {
    Element quizForm = content.selectFirst("#question-container");
    if (quizForm == null) {
      return;
    }
    Element quiz = new Element("div").addClass("formatted-quiz");
    for (Element question : quizForm.select(".quiz-question")) {
      Element title = question.selectFirst(".quiz-question-title");
      if (title == null) {
        continue;
      }
      Element prompt = title.selectFirst("p");
      String questionText = (prompt != null ? prompt : title).text();
      quiz.appendElement("h3").text("Question: " + questionText);

      Element choices = quiz.appendElement("ul");
      for (Element choice : question.select(".quiz-choice")) {
        Element label = choice.selectFirst(".radio-label-text");
        if (label != null) {
          choices.appendElement("li").text(label.text());
        }
      }
      quiz.appendElement("hr");
    }
    quizForm.replaceWith(quiz);
  }

  void removeChrome(Element content) {
    for (String selector : CHROME_SELECTORS) {
      for (Element element : content.select(selector)) {
        // select() includes the region itself when it matches; never detach the region
        if (element != content) {
          element.remove();
        }
      }
    }
  }

  static String imageSource(Element img) {
    for (String attribute : SOURCE_ATTRIBUTES) {
      String value = img.attr(attribute).trim();
      if (!value.isEmpty()) {
        return value;
      }
    }
    return "";
  }

  static String resolve(String baseUrl, String reference) {
    try {
      return new URL(new URL(baseUrl), reference).toExternalForm();
    } catch (MalformedURLException e) {
      return reference;
    }
  }

  static String urlPath(String url) {
    try {
      return new URL(url).getPath();
    } catch (MalformedURLException e) {
      return url;
    }
  }

  private static Integer dimension(String value) {
    String digits = value.trim().replaceAll("(?i)px$", "");
    if (digits.isEmpty()) {
      return null;
    }
    try {
      return Integer.valueOf(digits);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
