package com.flagship.shipping_workflow.quote;

import com.flagship.shipping_workflow.shipment.Parcel;
import com.flagship.shipping_workflow.shipment.ShipmentDetails;
import org.springframework.util.DigestUtils;

import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;

/**
 * Cache key for a shipment's quotes.
 *
 * Depends only on the origin and destination ZIPs, the weight rounded to 0.1 lb
 * and the dimensions truncated to whole inches, so two users shipping the same
 * parcel on the same route share one entry.
 */
public final class QuoteFingerprint {

    private QuoteFingerprint() {
        // Utility class
    }

    public static String of(ShipmentDetails shipment) {
        Parcel parcel = shipment.getParcel();
        String canonical = String.join("|",
                shipment.getFrom().getZip(),
                shipment.getTo().getZip(),
                parcel.getWeight().setScale(1, RoundingMode.HALF_UP).toPlainString(),
                parcel.getLength().intValue() + "x" + parcel.getWidth().intValue() + "x" + parcel.getHeight().intValue());
        return DigestUtils.md5DigestAsHex(canonical.getBytes(StandardCharsets.UTF_8));
    }
}
