package dev.webfetch.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

@ExtendWith(MockitoExtension.class)
class ManagedScraperBackendTest {

  private static final String URL = "https://spa.example.com/app";
  private static final ScrapeOptions OPTIONS =
      new ScrapeOptions(Duration.ofSeconds(20), ContentFormat.MARKDOWN);

  @Mock private RestClient restClient;

  @Mock private RestClient.RequestBodyUriSpec requestBodyUriSpec;

  @Mock private RestClient.RequestBodySpec requestBodySpec;

  @Mock private RestClient.ResponseSpec responseSpec;

  @Captor private ArgumentCaptor<ManagedScrapeRequest> requestCaptor;

  private ManagedScraperBackend backend;

  @BeforeEach
  void setUp() {
    backend = new ManagedScraperBackend(restClient);
  }

  private void stubRestClientChain() {
    when(restClient.post()).thenReturn(requestBodyUriSpec);
    when(requestBodyUriSpec.uri("/v1/scrape")).thenReturn(requestBodySpec);
    when(requestBodySpec.body(any(ManagedScrapeRequest.class))).thenReturn(requestBodySpec);
    when(requestBodySpec.retrieve()).thenReturn(responseSpec);
  }

  @Test
  void successReturnsMarkupPayload() {
    stubRestClientChain();
    when(responseSpec.body(ManagedScrapeResponse.class))
        .thenReturn(
            new ManagedScrapeResponse(
                true, new ManagedScrapeResponse.Data("# App", "<h1>App</h1>"), null));

    BackendResult result = backend.scrape(URL, OPTIONS);

    assertThat(result.success()).isTrue();
    assertThat(result.payload()).isEqualTo(new BackendPayload.Markup("# App", "<h1>App</h1>"));
  }

  @Test
  void requestAsksForMarkdownWithAttemptTimeout() {
    stubRestClientChain();
    when(responseSpec.body(ManagedScrapeResponse.class))
        .thenReturn(new ManagedScrapeResponse(true, new ManagedScrapeResponse.Data("x", null), null));

    backend.scrape(URL, OPTIONS);

    verify(requestBodySpec).body(requestCaptor.capture());
    ManagedScrapeRequest sent = requestCaptor.getValue();
    assertThat(sent.url()).isEqualTo(URL);
    assertThat(sent.formats()).isEqualTo(List.of("markdown"));
    assertThat(sent.timeout()).isEqualTo(20_000L);
  }

  @Test
  void htmlAndTextRequestsAskForHtml() {
    stubRestClientChain();
    when(responseSpec.body(ManagedScrapeResponse.class))
        .thenReturn(
            new ManagedScrapeResponse(
                true, new ManagedScrapeResponse.Data(null, "<p>x</p>"), null));

    backend.scrape(URL, new ScrapeOptions(Duration.ofSeconds(20), ContentFormat.HTML));
    backend.scrape(URL, new ScrapeOptions(Duration.ofSeconds(20), ContentFormat.TEXT));

    verify(requestBodySpec, times(2)).body(requestCaptor.capture());
    assertThat(requestCaptor.getAllValues())
        .extracting(ManagedScrapeRequest::formats)
        .containsExactly(List.of("html"), List.of("html"));
  }

  @Test
  void unsuccessfulResponseCarriesServiceError() {
    stubRestClientChain();
    when(responseSpec.body(ManagedScrapeResponse.class))
        .thenReturn(new ManagedScrapeResponse(false, null, "Insufficient credits"));

    BackendResult result = backend.scrape(URL, OPTIONS);

    assertThat(result.success()).isFalse();
    assertThat(result.error()).isEqualTo("Insufficient credits");
  }

  @Test
  void unsuccessfulResponseWithoutErrorGetsGenericMessage() {
    stubRestClientChain();
    when(responseSpec.body(ManagedScrapeResponse.class))
        .thenReturn(new ManagedScrapeResponse(false, null, null));

    assertThat(backend.scrape(URL, OPTIONS).error())
        .isEqualTo("Request failed without error details");
  }

  @Test
  void nullBodyIsAFailure() {
    stubRestClientChain();
    when(responseSpec.body(ManagedScrapeResponse.class)).thenReturn(null);

    assertThat(backend.scrape(URL, OPTIONS).error())
        .isEqualTo("Managed scraper returned no response body");
  }

  @Test
  void serverErrorIsCaptured() {
    stubRestClientChain();
    when(responseSpec.body(ManagedScrapeResponse.class))
        .thenThrow(
            HttpServerErrorException.create(
                HttpStatus.BAD_GATEWAY, "Bad Gateway", HttpHeaders.EMPTY, new byte[0], null));

    BackendResult result = backend.scrape(URL, OPTIONS);

    assertThat(result.error()).isEqualTo("HTTP 502");
    assertThat(result.statusCode()).isEqualTo(502);
  }

  @Test
  void timeoutIsCaptured() {
    stubRestClientChain();
    when(responseSpec.body(ManagedScrapeResponse.class))
        .thenThrow(new ResourceAccessException("Read timed out"));

    assertThat(backend.scrape(URL, OPTIONS).error()).isEqualTo("I/O error: Read timed out");
  }
}
