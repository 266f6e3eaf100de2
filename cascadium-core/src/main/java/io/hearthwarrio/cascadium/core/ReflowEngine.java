package io.hearthwarrio.cascadium.core;

import io.hearthwarrio.cascadium.core.css.InteractionState;
import io.hearthwarrio.cascadium.core.css.Origin;
import io.hearthwarrio.cascadium.core.css.SelectorMatcher;
import io.hearthwarrio.cascadium.core.css.Stylesheet;
import io.hearthwarrio.cascadium.core.css.StylesheetParseException;
import io.hearthwarrio.cascadium.core.css.StylesheetParser;
import io.hearthwarrio.cascadium.core.dom.Document;
import io.hearthwarrio.cascadium.core.layout.LayoutEngine;
import io.hearthwarrio.cascadium.core.layout.LayoutTree;
import io.hearthwarrio.cascadium.core.layout.LayoutTreeDump;
import io.hearthwarrio.cascadium.core.layout.SimpleTextMetrics;
import io.hearthwarrio.cascadium.core.layout.TextMetrics;
import io.hearthwarrio.cascadium.core.style.CascadeResolver;
import io.hearthwarrio.cascadium.core.style.ComputedStyle;
import io.hearthwarrio.cascadium.core.style.PropertyRegistry;
import io.hearthwarrio.cascadium.core.style.StyleDeclarationProcessor;
import io.hearthwarrio.cascadium.core.style.UserAgentStylesheet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * High-level entry point: one {@link #reflow} call parses the stylesheets, resolves the cascade and lays out
 * the document.
 * <p>
 * A reflow either completes and publishes a new {@link LayoutTree}, or leaves the previous one in place.
 * Malformed stylesheets do not abort a reflow: the rules recovered before the error are applied and the
 * error goes to the logger.
 * <p>
 * This class is not thread-safe and is expected to be used from a single thread. Different documents may be
 * reflowed concurrently by different instances.
 */
public class ReflowEngine {

    /**
     * Mutable to support runtime overrides; {@code null} keeps the engine silent.
     */
    private ReflowLogger logger;
    private TextMetrics textMetrics = new SimpleTextMetrics();
    private PropertyRegistry propertyRegistry = new PropertyRegistry();
    private InteractionState interactionState = InteractionState.NONE;
    private boolean userAgentStylesheet = true;

    private LayoutTree lastLayout;
    private List<UnresolvedReferenceWarning> lastWarnings = Collections.emptyList();

    public ReflowEngine() {
    }

    public ReflowEngine(ReflowLogger logger) {
        this.logger = logger;
    }

    public ReflowEngine withLogger(ReflowLogger logger) {
        this.logger = logger;
        return this;
    }

    public ReflowEngine withLoggingToStdOut(ReflowLogDetail detail) {
        this.logger = new StdOutReflowLogger(detail);
        return this;
    }

    public ReflowEngine withTextMetrics(TextMetrics textMetrics) {
        this.textMetrics = Objects.requireNonNull(textMetrics, "textMetrics must not be null");
        return this;
    }

    /**
     * Sets the registry of extension properties. The registry is read on every reflow, so properties registered
     * later take effect on the next reflow.
     */
    public ReflowEngine withPropertyRegistry(PropertyRegistry propertyRegistry) {
        this.propertyRegistry = Objects.requireNonNull(propertyRegistry, "propertyRegistry must not be null");
        return this;
    }

    public ReflowEngine withInteractionState(InteractionState interactionState) {
        this.interactionState = Objects.requireNonNull(interactionState, "interactionState must not be null");
        return this;
    }

    /**
     * Enables or disables the built-in user-agent stylesheet (enabled by default).
     */
    public ReflowEngine withUserAgentStylesheet(boolean enabled) {
        this.userAgentStylesheet = enabled;
        return this;
    }

    public PropertyRegistry getPropertyRegistry() {
        return propertyRegistry;
    }

    /**
     * Parses an author stylesheet with this engine's property registry.
     *
     * @throws StylesheetParseException if the text is structurally malformed
     */
    public Stylesheet parseStylesheet(String css, WarningSink warnings) {
        return new StylesheetParser(new StyleDeclarationProcessor(propertyRegistry), warnings)
                .parse(css, Origin.STYLESHEET, 0);
    }

    public LayoutTree reflow(Document document, String stylesheet, double viewportWidth, double viewportHeight) {
        return reflow(document, stylesheet == null ? List.of() : List.of(stylesheet), viewportWidth, viewportHeight);
    }

    /**
     * Runs a full reflow.
     *
     * @param document       element tree
     * @param stylesheets    author stylesheet texts, in cascade order
     * @param viewportWidth  viewport width, px
     * @param viewportHeight viewport height, px, or {@code NaN} when unbounded
     * @return the new layout tree, also available from {@link #getLastLayout()}
     */
    public LayoutTree reflow(Document document, List<String> stylesheets, double viewportWidth, double viewportHeight) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(stylesheets, "stylesheets must not be null");

        ReflowLogger log = logger;
        List<UnresolvedReferenceWarning> warnings = new ArrayList<>();
        WarningSink sink = warning -> {
            warnings.add(warning);
            if (log != null) {
                log.warning(warning);
            }
        };

        for (String id : document.findDuplicateIds()) {
            sink.warn(UnresolvedReferenceWarning.Kind.DUPLICATE_ID, id, "Id is used by more than one element");
        }

        long cascadeStart = System.nanoTime();
        List<Stylesheet> sheets = new ArrayList<>();
        if (userAgentStylesheet) {
            sheets.add(UserAgentStylesheet.get());
        }
        StylesheetParser parser = new StylesheetParser(new StyleDeclarationProcessor(propertyRegistry), sink);
        int order = 0;
        int parseErrors = 0;
        for (int i = 0; i < stylesheets.size(); i++) {
            Stylesheet sheet;
            try {
                sheet = parser.parse(stylesheets.get(i), Origin.STYLESHEET, order);
            } catch (StylesheetParseException e) {
                parseErrors++;
                if (log != null) {
                    log.parseError(i, e);
                }
                sheet = e.getRecovered();
            }
            sheets.add(sheet);
            order = sheet.getNextSourceOrder();
        }
        int ruleCount = 0;
        for (Stylesheet s : sheets) {
            ruleCount += s.getRules().size();
        }

        CascadeResolver cascade = new CascadeResolver(
                sheets, propertyRegistry, new SelectorMatcher(interactionState), sink);
        List<ComputedStyle> styles = cascade.resolve(document);
        long cascadeNanos = System.nanoTime() - cascadeStart;

        long layoutStart = System.nanoTime();
        LayoutTree tree = new LayoutEngine(textMetrics).layout(document, styles, viewportWidth, viewportHeight);
        long layoutNanos = System.nanoTime() - layoutStart;

        lastLayout = tree;
        lastWarnings = Collections.unmodifiableList(warnings);

        if (log != null) {
            ReflowStats stats = new ReflowStats(
                    document.size(), sheets.size(), ruleCount, warnings.size(), parseErrors, cascadeNanos, layoutNanos);
            String dump = log.detail() == ReflowLogDetail.TREE ? LayoutTreeDump.render(tree) : null;
            log.reflowCompleted(tree, stats, dump);
        }
        return tree;
    }

    /**
     * Layout tree of the last completed reflow, or {@code null} before the first one.
     */
    public LayoutTree getLastLayout() {
        return lastLayout;
    }

    /**
     * Warnings reported during the last completed reflow.
     */
    public List<UnresolvedReferenceWarning> getLastWarnings() {
        return lastWarnings;
    }
}
