package io.hearthwarrio.cascadium.allure;

import io.hearthwarrio.cascadium.core.ReflowLogDetail;
import io.hearthwarrio.cascadium.core.ReflowLogger;
import org.openqa.selenium.WebDriver;

/**
 * Factory methods for Allure-related Cascadium loggers.
 */
public final class CascadiumAllureLoggers {

    private CascadiumAllureLoggers() {
        // utility class
    }

    /**
     * Creates an Allure logger with summary detail and no screenshots.
     */
    public static ReflowLogger reflows() {
        return new AllureReflowLogger(ReflowLogDetail.SUMMARY);
    }

    public static ReflowLogger reflows(ReflowLogDetail detail) {
        return new AllureReflowLogger(detail);
    }

    /**
     * Creates an Allure logger that may attach a browser screenshot to every reflow step.
     */
    public static ReflowLogger reflows(WebDriver driver, ReflowLogDetail detail, boolean screenshots) {
        return new AllureReflowLogger(driver, detail, screenshots);
    }
}
