package io.snapbridge.model;

import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DOM screenshot decoded from the {@code data:<mime>;base64,<data>} URL an agent sends.
 */
public record Screenshot(String mimeType, byte[] bytes) {
    private static final Pattern DATA_URL = Pattern.compile("^data:(.+?);base64,(.*)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    public static Screenshot fromDataUrl(String dataUrl) {
        if (dataUrl == null) {
            throw new IllegalArgumentException("bad dataurl");
        }
        Matcher m = DATA_URL.matcher(dataUrl.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("bad dataurl");
        }
        try {
            return new Screenshot(m.group(1), Base64.getMimeDecoder().decode(m.group(2)));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("bad dataurl", e);
        }
    }
}
