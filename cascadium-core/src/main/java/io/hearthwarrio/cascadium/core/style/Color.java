package io.hearthwarrio.cascadium.core.style;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * sRGB color with 8-bit channels and an alpha between 0 and 1.
 */
public final class Color implements StyleValue {

    public static final Color BLACK = new Color(0, 0, 0, 1.0);
    public static final Color WHITE = new Color(255, 255, 255, 1.0);
    public static final Color TRANSPARENT = new Color(0, 0, 0, 0.0);

    private static final Map<String, Color> NAMED = new HashMap<>();

    static {
        named("black", 0x000000);
        named("white", 0xffffff);
        named("red", 0xff0000);
        named("green", 0x008000);
        named("lime", 0x00ff00);
        named("blue", 0x0000ff);
        named("yellow", 0xffff00);
        named("cyan", 0x00ffff);
        named("aqua", 0x00ffff);
        named("magenta", 0xff00ff);
        named("fuchsia", 0xff00ff);
        named("gray", 0x808080);
        named("grey", 0x808080);
        named("silver", 0xc0c0c0);
        named("maroon", 0x800000);
        named("olive", 0x808000);
        named("navy", 0x000080);
        named("purple", 0x800080);
        named("teal", 0x008080);
        named("orange", 0xffa500);
        named("pink", 0xffc0cb);
        named("brown", 0xa52a2a);
        named("gold", 0xffd700);
        named("indigo", 0x4b0082);
        named("violet", 0xee82ee);
        named("coral", 0xff7f50);
        named("salmon", 0xfa8072);
        named("tomato", 0xff6347);
        named("khaki", 0xf0e68c);
        named("crimson", 0xdc143c);
        named("darkgray", 0xa9a9a9);
        named("darkgrey", 0xa9a9a9);
        named("lightgray", 0xd3d3d3);
        named("lightgrey", 0xd3d3d3);
        named("whitesmoke", 0xf5f5f5);
        named("gainsboro", 0xdcdcdc);
        named("darkblue", 0x00008b);
        named("lightblue", 0xadd8e6);
        named("skyblue", 0x87ceeb);
        named("steelblue", 0x4682b4);
        named("royalblue", 0x4169e1);
        named("darkgreen", 0x006400);
        named("lightgreen", 0x90ee90);
        named("darkred", 0x8b0000);
        NAMED.put("transparent", TRANSPARENT);
    }

    private static void named(String name, int rgb) {
        NAMED.put(name, new Color((rgb >> 16) & 0xff, (rgb >> 8) & 0xff, rgb & 0xff, 1.0));
    }

    private final int red;
    private final int green;
    private final int blue;
    private final double alpha;

    private Color(int red, int green, int blue, double alpha) {
        this.red = red;
        this.green = green;
        this.blue = blue;
        this.alpha = alpha;
    }

    /**
     * Creates a color, clamping every channel into range.
     */
    public static Color rgba(int red, int green, int blue, double alpha) {
        return new Color(clamp(red), clamp(green), clamp(blue), Math.max(0.0, Math.min(1.0, alpha)));
    }

    public static Color rgb(int red, int green, int blue) {
        return rgba(red, green, blue, 1.0);
    }

    /**
     * Parses {@code #rgb}, {@code #rgba}, {@code #rrggbb}, {@code #rrggbbaa}, {@code rgb(...)},
     * {@code rgba(...)} and named colors.
     *
     * @return parsed color, or {@code null} if the text is not a color
     */
    public static Color parse(String text) {
        if (text == null) {
            return null;
        }
        String v = text.trim().toLowerCase(Locale.ROOT);
        if (v.isEmpty()) {
            return null;
        }
        try {
            if (v.startsWith("#")) {
                return parseHex(v.substring(1));
            }
            if (v.startsWith("rgb(") || v.startsWith("rgba(")) {
                return parseFunction(v);
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return NAMED.get(v);
    }

    private static Color parseHex(String hex) {
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) {
                return null;
            }
        }
        switch (hex.length()) {
            case 3:
            case 4: {
                int r = Character.digit(hex.charAt(0), 16) * 17;
                int g = Character.digit(hex.charAt(1), 16) * 17;
                int b = Character.digit(hex.charAt(2), 16) * 17;
                double a = hex.length() == 4 ? Character.digit(hex.charAt(3), 16) * 17 / 255.0 : 1.0;
                return new Color(r, g, b, a);
            }
            case 6:
            case 8: {
                int r = Integer.parseInt(hex.substring(0, 2), 16);
                int g = Integer.parseInt(hex.substring(2, 4), 16);
                int b = Integer.parseInt(hex.substring(4, 6), 16);
                double a = hex.length() == 8 ? Integer.parseInt(hex.substring(6, 8), 16) / 255.0 : 1.0;
                return new Color(r, g, b, a);
            }
            default:
                return null;
        }
    }

    private static Color parseFunction(String v) {
        int open = v.indexOf('(');
        if (!v.endsWith(")")) {
            return null;
        }
        String[] parts = v.substring(open + 1, v.length() - 1).replace('/', ',').split("[,\\s]+");
        int n = 0;
        String[] channels = new String[4];
        for (String p : parts) {
            if (p.isEmpty()) {
                continue;
            }
            if (n == 4) {
                return null;
            }
            channels[n++] = p;
        }
        if (n < 3) {
            return null;
        }
        int r = channel(channels[0]);
        int g = channel(channels[1]);
        int b = channel(channels[2]);
        double a = 1.0;
        if (n == 4) {
            String alpha = channels[3];
            a = alpha.endsWith("%")
                    ? Double.parseDouble(alpha.substring(0, alpha.length() - 1)) / 100.0
                    : Double.parseDouble(alpha);
        }
        return rgba(r, g, b, a);
    }

    private static int channel(String text) {
        if (text.endsWith("%")) {
            return (int) Math.round(Double.parseDouble(text.substring(0, text.length() - 1)) * 255 / 100.0);
        }
        return (int) Math.round(Double.parseDouble(text));
    }

    private static int clamp(int channel) {
        return Math.max(0, Math.min(255, channel));
    }

    public int getRed() {
        return red;
    }

    public int getGreen() {
        return green;
    }

    public int getBlue() {
        return blue;
    }

    public double getAlpha() {
        return alpha;
    }

    public boolean isTransparent() {
        return alpha == 0.0;
    }

    /**
     * Packs the color as {@code 0xAARRGGBB}.
     */
    public int toArgb() {
        int a = (int) Math.round(alpha * 255);
        return (a << 24) | (red << 16) | (green << 8) | blue;
    }

    @Override
    public String toCss() {
        if (alpha >= 1.0) {
            return String.format(Locale.ROOT, "#%02x%02x%02x", red, green, blue);
        }
        return "rgba(" + red + ", " + green + ", " + blue + ", " + Length.format(alpha) + ")";
    }

    @Override
    public String toString() {
        return toCss();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Color)) return false;
        Color that = (Color) o;
        return red == that.red && green == that.green && blue == that.blue && Double.compare(alpha, that.alpha) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(red, green, blue, alpha);
    }
}
