package com.holdco.tycoon.deal;

/**
 * The player's declared acquisition focus.
 *
 * @param sectorId  focus sector, or null for none
 * @param subType   sub-type within the sector; only honoured from sourcing tier 2
 */
public record MAFocus(String sectorId, SizePreference sizePreference, String subType) {

    public static final MAFocus NONE = new MAFocus(null, SizePreference.ANY, null);

    public MAFocus {
        if (sizePreference == null) {
            sizePreference = SizePreference.ANY;
        }
    }

    public boolean hasSector() {
        return sectorId != null;
    }
}
