package com.connector.service.api;

import com.connector.expression.Scope;
import com.connector.model.CallDefinition;
import com.connector.model.IntegrationDefinition;
import com.connector.model.ResultItem;
import java.util.Iterator;

/**
 * Drives repeated executions of a Call until its items are exhausted, its limit is reached or its
 * pagination stops.
 */
public interface PaginationEngine {

    /**
     * Returns a lazy, finite, non-restartable iterator over the Call's items. Pages are only requested when
     * the consumer asks for more items than are buffered.
     *
     * @param limit Maximum number of items to yield; {@code null} for no limit. A limit of {@code 0} or less
     *              makes no request at all.
     * @throws com.connector.exception.ConfigurationException from the iterator when the pagination cursor
     *                                                        stops advancing.
     */
    Iterator<ResultItem> iterate(CallDefinition call, IntegrationDefinition integration, Scope scope, Long limit);
}
