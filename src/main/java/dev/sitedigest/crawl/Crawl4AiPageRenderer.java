package dev.sitedigest.crawl;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link PageRenderer} backed by the Crawl4AI sidecar.
 *
 * <p>Requests are stateless: every page gets a fresh browser page on the sidecar, which Crawl4AI
 * releases when the response is returned. A session is therefore a local handle for one crawl run;
 * once closed it rejects further renders.
 */
@Component
public class Crawl4AiPageRenderer implements PageRenderer {

  private static final Logger log = LoggerFactory.getLogger(Crawl4AiPageRenderer.class);

  private final Crawl4AiClient crawl4AiClient;

  public Crawl4AiPageRenderer(Crawl4AiClient crawl4AiClient) {
    this.crawl4AiClient = crawl4AiClient;
  }

  @Override
  public RenderSession openSession() {
    String runId = "sitedigest-" + UUID.randomUUID();
    log.debug("Opened render session {}", runId);
    return new Crawl4AiSession(crawl4AiClient, runId);
  }

  static final class Crawl4AiSession implements RenderSession {

    private final Crawl4AiClient client;
    private final String runId;
    private int renderCount;
    private boolean closed;

    Crawl4AiSession(Crawl4AiClient client, String runId) {
      this.client = client;
      this.runId = runId;
    }

    @Override
    public RenderedPage render(String url, RenderOptions options) {
      if (closed) {
        throw new IllegalStateException("Render session " + runId + " is closed");
      }
      renderCount++;
      return client.render(url, options);
    }

    @Override
    public void close() {
      if (!closed) {
        closed = true;
        log.debug("Closed render session {} after {} render requests", runId, renderCount);
      }
    }

    String runId() {
      return runId;
    }

    int renderCount() {
      return renderCount;
    }

    boolean isClosed() {
      return closed;
    }
  }
}
