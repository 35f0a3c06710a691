package com.sportsync.resolution.review;

import com.sportsync.resolution.store.JsonCodec;
import com.sportsync.resolution.support.H2Database;
import org.junit.jupiter.api.DisplayName;

@DisplayName("JdbcReviewQueue (H2, PostgreSQL mode)")
class JdbcReviewQueueTest extends AbstractReviewQueueTest {

    @Override
    protected ReviewQueue createQueue() {
        return new JdbcReviewQueue(H2Database.newExecutor(), new JsonCodec());
    }
}
