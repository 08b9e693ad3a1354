package com.anomalywatch.training.pipeline;

import org.slf4j.Logger;

final class StageBanner {

    private static final String RULE = "=".repeat(60);

    private StageBanner() {
    }

    static void log(Logger log, String title) {
        log.info(RULE);
        log.info(title);
        log.info(RULE);
    }
}
