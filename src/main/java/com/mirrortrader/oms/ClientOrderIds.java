package com.mirrortrader.oms;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.UUID;

/**
 * Derives the client order id of a mirror order from the source order it copies.
 *
 * <p>The id is a name-based UUID of {@code market:sourceOrderId}: 36 characters, and the same
 * source order always maps to the same id, so a redelivered OrderOpened event is recognized
 * as already mirrored instead of being submitted twice.
 */
public final class ClientOrderIds {

    public static final int MAX_LENGTH = 36;

    private ClientOrderIds() {}

    public static String forSource(String market, long sourceOrderId) {
        String name = market.toLowerCase(Locale.ROOT) + ":" + sourceOrderId;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
