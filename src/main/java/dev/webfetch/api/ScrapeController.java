package dev.webfetch.api;

import dev.webfetch.retrieval.RetrievalResult;
import dev.webfetch.retrieval.RetrievalService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface for retrieval, available under the {@code web} profile. A failed retrieval is still
 * a 200 with {@code success=false}; only malformed input yields a 400 problem detail.
 */
@RestController
@RequestMapping("/api")
public class ScrapeController {

  private final RetrievalService retrievalService;

  public ScrapeController(RetrievalService retrievalService) {
    this.retrievalService = retrievalService;
  }

  @PostMapping("/scrape")
  public RetrievalResult scrape(@Valid @RequestBody ScrapeRequestBody body) {
    return retrievalService.retrieve(body.toRetrievalRequest());
  }
}
