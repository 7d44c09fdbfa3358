package com.vtrates.application.port.in;

import com.vtrates.domain.model.UpdateResult;
import io.vertx.core.Future;

import java.util.List;

/**
 * Input port for refreshing the rate cache from external sources
 */
public interface RateUpdateUseCase {

    /**
     * Fetch from every registered source, merge and persist
     */
    Future<UpdateResult> run();

    /**
     * Fetch from a single source only; {@code null} or "all" means every source.
     * Direct rates of the other sources are carried over from the current snapshot.
     */
    Future<UpdateResult> run(String sourceName);

    /**
     * Names of the registered sources. {@link #run(String)} also accepts the
     * provider name a stand-in source replaces.
     */
    List<String> sourceNames();
}
