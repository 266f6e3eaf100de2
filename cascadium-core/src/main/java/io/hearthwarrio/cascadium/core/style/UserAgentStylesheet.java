package io.hearthwarrio.cascadium.core.style;

import io.hearthwarrio.cascadium.core.WarningSink;
import io.hearthwarrio.cascadium.core.css.Origin;
import io.hearthwarrio.cascadium.core.css.Stylesheet;
import io.hearthwarrio.cascadium.core.css.StylesheetParser;

/**
 * Built-in default styles, modeled on common browser defaults. Parsed once and shared.
 */
public final class UserAgentStylesheet {

    static final String CSS = String.join("\n",
            "html, body, div, section, article, header, footer, nav, main, aside, form, fieldset, figure,",
            "blockquote, pre, address, dl, dt, dd, hr, p, ul, ol, h1, h2, h3, h4, h5, h6 { display: block; }",
            "li { display: list-item; }",
            "span, a, b, i, em, strong, label, small, code, abbr, sub, sup, u, s { display: inline; }",
            "button, input, select, textarea, img { display: inline-block; }",
            "head, script, style, title, meta, link, template, base, noscript { display: none; }",
            "[hidden] { display: none; }",
            "body { margin: 8px; }",
            "p { margin-top: 1em; margin-bottom: 1em; }",
            "h1 { font-size: 2em; margin-top: 0.67em; margin-bottom: 0.67em; font-weight: bold; }",
            "h2 { font-size: 1.5em; margin-top: 0.83em; margin-bottom: 0.83em; font-weight: bold; }",
            "h3 { font-size: 1.17em; margin-top: 1em; margin-bottom: 1em; font-weight: bold; }",
            "h4 { margin-top: 1.33em; margin-bottom: 1.33em; font-weight: bold; }",
            "h5 { font-size: 0.83em; margin-top: 1.67em; margin-bottom: 1.67em; font-weight: bold; }",
            "h6 { font-size: 0.67em; margin-top: 2.33em; margin-bottom: 2.33em; font-weight: bold; }",
            "ul, ol { margin-top: 1em; margin-bottom: 1em; padding-left: 40px; }",
            "b, strong { font-weight: bold; }",
            "button { padding: 1px 6px; border: 2px outset #767676; background-color: #f0f0f0; color: #000;"
                    + " font: 11px system-ui; text-align: center; }",
            "input { padding: 1px 2px; border: 2px inset #767676; background-color: #fff; font: 11px system-ui; }"
    );

    private static final Stylesheet STYLESHEET = new StylesheetParser(
            new StyleDeclarationProcessor(new PropertyRegistry()), WarningSink.IGNORE
    ).parse(CSS, Origin.USER_AGENT, 0);

    private UserAgentStylesheet() {
    }

    public static Stylesheet get() {
        return STYLESHEET;
    }
}
