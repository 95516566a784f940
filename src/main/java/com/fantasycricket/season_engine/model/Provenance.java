package com.fantasycricket.season_engine.model;

/**
 * How much evidence backs a canonical player's identity.
 * Ordered weakest to strongest; a player only ever moves forward.
 */
public enum Provenance {

    /** Seeded from a previous season's roster, not yet seen this season. */
    LEGACY_IMPORT,

    /** Created or matched from a display name only. */
    NAME_DERIVED,

    /** Linked to a federation-issued stable identifier. */
    IDENTIFIER_CONFIRMED;

    public boolean outranks(Provenance other) {
        return this.ordinal() > other.ordinal();
    }

    public Provenance promoteTo(Provenance evidence) {
        return evidence.outranks(this) ? evidence : this;
    }
}
