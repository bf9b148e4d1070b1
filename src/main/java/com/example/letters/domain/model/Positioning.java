package com.example.letters.domain.model;

import com.example.letters.domain.exception.ConfigurationException;

/**
 * Fixed first-page geometry: margins, envelope window boxes, the date line and where the body starts.
 */
public record Positioning(
        Margins margins,
        AddressPosition returnAddress,
        AddressPosition recipientAddress,
        DatePosition datePosition,
        double bodyStartY
) {

    public Positioning {
        margins = margins != null ? margins : Margins.defaults();
        returnAddress = returnAddress != null ? returnAddress : AddressPosition.returnAddressDefaults();
        recipientAddress = recipientAddress != null ? recipientAddress : AddressPosition.recipientAddressDefaults();
        datePosition = datePosition != null ? datePosition : DatePosition.defaults();
        if (!(bodyStartY > 0)) {
            throw new ConfigurationException("Body start must be positive but was " + bodyStartY);
        }
        if (returnAddress.overlaps(recipientAddress)) {
            throw new ConfigurationException("Return address and recipient address boxes overlap.");
        }
    }

    public static Positioning defaults() {
        return new Positioning(
                Margins.defaults(),
                AddressPosition.returnAddressDefaults(),
                AddressPosition.recipientAddressDefaults(),
                DatePosition.defaults(),
                3.67
        );
    }

    public Positioning withMargins(Margins newMargins) {
        return new Positioning(newMargins, returnAddress, recipientAddress, datePosition, bodyStartY);
    }
}
