package com.ctdl.scout.service;

import com.ctdl.scout.config.ScoutProperties;
import com.ctdl.scout.service.search.ResultPager;
import com.ctdl.scout.service.search.ResultScraper;
import com.ctdl.scout.service.search.RetryPolicy;
import com.ctdl.scout.service.search.SearchHttpClient;
import com.ctdl.scout.service.search.SearchRequestException;
import com.ctdl.scout.service.validate.LinkProbe;
import com.ctdl.scout.service.validate.LinkValidator;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mockito;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(OutputCaptureExtension.class)
class FileSearchServiceTest {

    private HttpServer server;
    private String base;
    private int closedPort;
    private final List<String> searchQueries = new CopyOnWriteArrayList<>();
    private SearchHttpClient searchHttpClient;
    private FileSearchService searchService;

    @BeforeEach
    void setUp() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        base = "http://127.0.0.1:" + server.getAddress().getPort();
        server.createContext("/search", exchange -> {
            searchQueries.add(URLDecoder.decode(exchange.getRequestURI().getRawQuery(), StandardCharsets.UTF_8));
            byte[] body = resultsPage().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.createContext("/files/intro.pdf", exchange -> {
            exchange.sendResponseHeaders(200, 3);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(new byte[]{1, 2, 3});
            }
        });
        server.createContext("/files/missing.pdf", exchange -> exchange.sendResponseHeaders(404, -1));
        server.start();

        ScoutProperties properties = new ScoutProperties();
        properties.getSearch().setUrl(base + "/search");
        searchHttpClient = new SearchHttpClient(new RetryPolicy(5, 0.1, Duration.ofSeconds(1)), Duration.ofSeconds(5), d -> { });
        LoggerService logger = Mockito.mock(LoggerService.class);
        ResultPager pager = new ResultPager(searchHttpClient, new ResultScraper("h3.r", 7), properties);
        LinkValidator validator = new LinkValidator(new LinkProbe(Duration.ofSeconds(5), "scout-test"), properties, logger);
        searchService = new FileSearchService(pager, validator, properties, logger);
    }

    @AfterEach
    void tearDown() {
        searchHttpClient.close();
        server.stop(0);
    }

    @Test
    void findsReachableLinksForSinglePage(CapturedOutput output) {
        List<String> links = searchService.search("algorithms", "pdf", 10);

        String intro = base + "/files/intro.pdf";
        String dead = "http://127.0.0.1:" + closedPort + "/files/dead.pdf";
        String missing = base + "/files/missing.pdf";

        assertThat(searchQueries).hasSize(1);
        assertThat(searchQueries.get(0)).contains("q=filetype:pdf algorithms").contains("start=0");
        assertThat(links).containsExactly(intro, missing);
        assertThat(output.getOut()).contains(
                "code: 200\turl: " + intro,
                "code: 0\turl: " + dead,
                "code: 404\turl: " + missing);
    }

    @Test
    void defaultsToTenPdfResults() {
        searchService.search("algorithms");

        assertThat(searchQueries).hasSize(1);
        assertThat(searchQueries.get(0)).contains("q=filetype:pdf algorithms");
    }

    @Test
    void pagesThroughLargerLimits() {
        List<String> links = searchService.search("algorithms", "pdf", 30);

        assertThat(searchQueries).hasSize(3);
        assertThat(searchQueries).anySatisfy(q -> assertThat(q).contains("start=20"));
        assertThat(links).containsExactly(base + "/files/intro.pdf", base + "/files/missing.pdf");
    }

    @Test
    void searchFailurePropagates() {
        server.removeContext("/search");
        server.createContext("/search", exchange -> exchange.sendResponseHeaders(503, -1));

        assertThatThrownBy(() -> searchService.search("algorithms", "pdf", 10))
                .isInstanceOf(SearchRequestException.class);
    }

    private String resultsPage() {
        return "<html><body>"
                + "<h3 class=\"r\"><a href=\"/url?q=" + base + "/files/intro.pdf&amp;sa=U\">Intro</a></h3>"
                + "<h3 class=\"r\"><a href=\"/url?q=http://127.0.0.1:" + closedPort + "/files/dead.pdf&amp;sa=U\">Dead</a></h3>"
                + "<h3 class=\"r\"><a href=\"/url?q=" + base + "/files/missing.pdf&amp;ved=2\">Missing</a></h3>"
                + "</body></html>";
    }
}
