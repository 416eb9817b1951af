package com.xmer.qbittorrent.bridge.util;

import com.xmer.qbittorrent.bridge.error.ErrorCodes;
import com.xmer.qbittorrent.bridge.error.NonRetryableException;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility for deriving the torrent identity from a magnet link.
 * The result is the 40 character lower-case hex info-hash qBittorrent reports for the torrent,
 * so it can be used directly as the tracked-set key.
 */
public final class InfoHash {

    private static final String MAGNET_PREFIX = "magnet:";
    private static final Pattern BTIH = Pattern.compile("xt=urn:btih:([a-zA-Z0-9]+)");
    private static final String BASE32_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ234567";
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private InfoHash() {
        // Utility class
    }

    /**
     * Extract the info-hash of a magnet link.
     * Accepts the 40 character hex form and the 32 character base-32 form.
     */
    public static String fromMagnet(String magnetLink) {
        if (magnetLink == null || !magnetLink.startsWith(MAGNET_PREFIX)) {
            throw new NonRetryableException("Invalid magnet link: must start with 'magnet:'",
                    ErrorCodes.INVALID_MAGNET);
        }

        Matcher matcher = BTIH.matcher(magnetLink);
        if (!matcher.find()) {
            throw new NonRetryableException("Invalid magnet link: no btih hash found", ErrorCodes.INVALID_MAGNET);
        }

        String raw = matcher.group(1);
        if (raw.length() == 40) {
            return raw.toLowerCase(Locale.ROOT);
        }
        if (raw.length() == 32) {
            return base32ToHex(raw.toUpperCase(Locale.ROOT));
        }

        throw new NonRetryableException("Invalid magnet link: unexpected hash length " + raw.length(),
                ErrorCodes.INVALID_MAGNET, Map.of("length", raw.length()));
    }

    /**
     * Decode upper-case base-32 into hex, 5 bits in per symbol and 4 bits out per nibble.
     * Bits that do not fill a whole nibble at the end are dropped.
     */
    static String base32ToHex(String base32) {
        StringBuilder hex = new StringBuilder(base32.length() * 5 / 4);
        int buffer = 0;
        int bits = 0;

        for (int i = 0; i < base32.length(); i++) {
            char symbol = base32.charAt(i);
            int value = BASE32_ALPHABET.indexOf(symbol);
            if (value < 0) {
                throw new NonRetryableException("Invalid base32 character: " + symbol, ErrorCodes.INVALID_MAGNET);
            }

            buffer = (buffer << 5) | value;
            bits += 5;
            while (bits >= 4) {
                bits -= 4;
                hex.append(HEX[(buffer >> bits) & 0xF]);
            }
            buffer &= (1 << bits) - 1;
        }

        return hex.toString();
    }
}
