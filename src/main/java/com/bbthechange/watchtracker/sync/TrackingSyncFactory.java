package com.bbthechange.watchtracker.sync;

import com.bbthechange.watchtracker.config.TrackingProperties;
import com.bbthechange.watchtracker.service.TrackingStoreClient;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Creates a {@link TrackingSync} per consuming context.
 */
@Component
public class TrackingSyncFactory {

    private final TrackingStoreClient store;
    private final Executor writeExecutor;
    private final TrackingProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    @Autowired
    public TrackingSyncFactory(TrackingStoreClient store,
                               @Qualifier("trackingWriteExecutor") Executor writeExecutor,
                               TrackingProperties properties,
                               Clock clock,
                               MeterRegistry meterRegistry) {
        this.store = store;
        this.writeExecutor = writeExecutor;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public TrackingSync create(UserContext user) {
        return new TrackingSync(user, store, writeExecutor, properties.getWriteTimeout(), clock, meterRegistry);
    }
}
