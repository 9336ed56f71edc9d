package com.newscorpus.core.http;

import com.newscorpus.core.api.IFetcher;
import com.newscorpus.core.model.FetchResult;
import com.newscorpus.core.util.JitterPolicy;
import com.newscorpus.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 호스트별 요청 간격 데코레이터.
 * 같은 호스트로의 두 번째 요청부터 JitterPolicy 만큼 쉰 뒤 위임한다.
 */
public final class PacedFetcher implements IFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(PacedFetcher.class);

    private final IFetcher delegate;
    private final JitterPolicy jitter;
    private final Sleeper sleeper;
    private final Set<String> contactedHosts = new HashSet<>();

    public PacedFetcher(IFetcher delegate, JitterPolicy jitter, Sleeper sleeper) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.jitter = Objects.requireNonNull(jitter, "jitter");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public synchronized FetchResult fetch(URI url) {
        String host = (url.getHost() == null) ? "" : url.getHost().toLowerCase(Locale.ROOT);
        if (!contactedHosts.add(host)) {
            Duration d = jitter.nextDelay();
            try {
                LOG.debug("Pacing {} ms before {}", d.toMillis(), url);
                sleeper.sleep(d);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return FetchResult.transportError(url, StandardCharsets.UTF_8, 0, "interrupted while pacing");
            }
        }
        return delegate.fetch(url);
    }

    @Override
    public void close() throws Exception {
        delegate.close();
    }
}
