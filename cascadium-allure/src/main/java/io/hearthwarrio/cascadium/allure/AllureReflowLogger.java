package io.hearthwarrio.cascadium.allure;

import io.hearthwarrio.cascadium.core.ReflowLogDetail;
import io.hearthwarrio.cascadium.core.ReflowLogger;
import io.hearthwarrio.cascadium.core.ReflowStats;
import io.hearthwarrio.cascadium.core.UnresolvedReferenceWarning;
import io.hearthwarrio.cascadium.core.css.StylesheetParseException;
import io.hearthwarrio.cascadium.core.layout.LayoutTree;
import io.qameta.allure.Allure;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Allure logger for reflows.
 * <p>
 * Lives in cascadium-allure to avoid leaking Allure dependency into core.
 */
public final class AllureReflowLogger implements ReflowLogger {

    private final WebDriver driver;
    private final ReflowLogDetail detail;
    private final boolean attachScreenshot;

    /**
     * Creates a logger without a browser; screenshots are never attached.
     */
    public AllureReflowLogger(ReflowLogDetail detail) {
        this.driver = null;
        this.detail = detail == null ? ReflowLogDetail.NONE : detail;
        this.attachScreenshot = false;
    }

    public AllureReflowLogger(WebDriver driver, ReflowLogDetail detail, boolean attachScreenshot) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.detail = detail == null ? ReflowLogDetail.NONE : detail;
        this.attachScreenshot = attachScreenshot;
    }

    @Override
    public ReflowLogDetail detail() {
        return detail;
    }

    public boolean isAttachScreenshot() {
        return attachScreenshot;
    }

    @Override
    public void warning(UnresolvedReferenceWarning warning) {
        Allure.step("Cascadium warning: " + warning.getKind() + " " + warning.getSubject());
    }

    @Override
    public void parseError(int stylesheetIndex, StylesheetParseException error) {
        Allure.step("Cascadium: stylesheet #" + stylesheetIndex + " malformed", () -> {
            String txt = "error: " + error.getMessage() + '\n' +
                    "recovered rules: " + error.getRecoveredRules().size() + '\n';
            attachText("Stylesheet error", txt);
        });
    }

    @Override
    public void reflowCompleted(LayoutTree tree, ReflowStats stats, String dump) {
        String title = "Cascadium: reflow " + stats.getElementCount() + " elements at " +
                format(tree.getViewportWidth()) + "x" + format(tree.getViewportHeight());

        Allure.step(title, () -> {
            StringBuilder sb = new StringBuilder(256);
            sb.append("elements: ").append(stats.getElementCount()).append('\n')
                    .append("warnings: ").append(stats.getWarningCount()).append('\n');

            if (detail != ReflowLogDetail.NONE) {
                sb.append("stylesheets: ").append(stats.getStylesheetCount()).append('\n')
                        .append("rules: ").append(stats.getRuleCount()).append('\n')
                        .append("parse errors: ").append(stats.getParseErrorCount()).append('\n')
                        .append("cascade ns: ").append(stats.getCascadeNanos()).append('\n')
                        .append("layout ns: ").append(stats.getLayoutNanos()).append('\n');
            }
            attachText("Reflow stats", sb.toString());

            if (dump != null) {
                attachText("Layout tree", dump);
            }

            if (attachScreenshot && driver instanceof TakesScreenshot) {
                byte[] png = ((TakesScreenshot) driver).getScreenshotAs(OutputType.BYTES);
                Allure.addAttachment(
                        "Screenshot",
                        "image/png",
                        new ByteArrayInputStream(png),
                        ".png"
                );
            }
        });
    }

    private static void attachText(String name, String text) {
        byte[] txt = text.getBytes(StandardCharsets.UTF_8);
        Allure.addAttachment(name, "text/plain", new ByteArrayInputStream(txt), ".txt");
    }

    private static String format(double v) {
        if (Double.isNaN(v)) {
            return "auto";
        }
        return v == Math.rint(v) ? String.valueOf((long) v) : String.valueOf(v);
    }
}
