package com.newsflow.publishing;

import com.newsflow.core.model.NewsArticle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Article source backed by an RSS 2.0 or Atom feed.
 */
public class FeedArticleSource implements ArticleSource {

    private static final Logger log = LoggerFactory.getLogger(FeedArticleSource.class);

    private static final Duration TIMEOUT = Duration.ofSeconds(20);

    private final String name;
    private final URI feedUrl;
    private final HttpClient httpClient;

    public FeedArticleSource(String name, String feedUrl) {
        this(name, feedUrl, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    FeedArticleSource(String name, String feedUrl, HttpClient httpClient) {
        this.name = name;
        this.feedUrl = URI.create(feedUrl);
        this.httpClient = httpClient;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<NewsArticle> fetch() throws IOException, InterruptedException {
        var request = HttpRequest.newBuilder(feedUrl)
                .timeout(TIMEOUT)
                .header("Accept", "application/rss+xml, application/atom+xml, application/xml")
                .GET()
                .build();
        HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        if (response.statusCode() != 200) {
            throw new IOException("Feed " + feedUrl + " returned HTTP " + response.statusCode());
        }
        try (InputStream body = response.body()) {
            List<NewsArticle> articles = parse(body);
            log.info("Fetched {} articles from feed '{}'", articles.size(), name);
            return articles;
        }
    }

    List<NewsArticle> parse(InputStream xml) throws IOException {
        Document doc;
        try {
            var factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            doc = factory.newDocumentBuilder().parse(xml);
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Malformed feed from " + feedUrl + ": " + e.getMessage(), e);
        }

        List<NewsArticle> articles = new ArrayList<>();
        NodeList items = doc.getElementsByTagNameNS("*", "item");
        for (int i = 0; i < items.getLength(); i++) {
            Element item = (Element) items.item(i);
            articles.add(article(text(item, "title"), text(item, "link"),
                    text(item, "description"), text(item, "pubDate")));
        }

        NodeList entries = doc.getElementsByTagNameNS("*", "entry");
        for (int i = 0; i < entries.getLength(); i++) {
            Element entry = (Element) entries.item(i);
            String content = text(entry, "summary");
            if (content.isEmpty()) content = text(entry, "content");
            String published = text(entry, "published");
            if (published.isEmpty()) published = text(entry, "updated");
            articles.add(article(text(entry, "title"), atomLink(entry), content, published));
        }

        return articles.stream()
                .filter(a -> !a.url().isBlank() && !a.title().isBlank())
                .toList();
    }

    private NewsArticle article(String title, String url, String content, String publishedAt) {
        return new NewsArticle(title, url, "feed:" + name, content, publishedAt, 0.0);
    }

    private static String text(Element parent, String localName) {
        NodeList nodes = parent.getElementsByTagNameNS("*", localName);
        return nodes.getLength() > 0 ? nodes.item(0).getTextContent().strip() : "";
    }

    private static String atomLink(Element entry) {
        NodeList links = entry.getElementsByTagNameNS("*", "link");
        for (int i = 0; i < links.getLength(); i++) {
            Element link = (Element) links.item(i);
            String rel = link.getAttribute("rel");
            if (rel.isEmpty() || "alternate".equals(rel)) {
                return link.getAttribute("href");
            }
        }
        return "";
    }
}
