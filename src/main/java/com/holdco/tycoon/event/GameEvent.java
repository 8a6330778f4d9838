package com.holdco.tycoon.event;

/**
 * The event drawn for a round. Sealed interface with one record per shape; switch on
 * {@link #type()} or use the records directly.
 *
 * Choice shapes carry everything the player needs to decide; nothing in them is applied
 * until a choice is resolved.
 */
public sealed interface GameEvent permits GameEvent.MarketEvent, GameEvent.PortfolioEvent,
    GameEvent.ReferralDeal, GameEvent.SectorEvent, GameEvent.QuietYear, GameEvent.UnsolicitedOffer,
    GameEvent.EquityDemand, GameEvent.SellerNoteRenegotiation, GameEvent.MboProposal {

    String id();

    EventType type();

    String title();

    String description();

    /**
     * The single business the event targets, or null for holdco-wide and sector-wide events.
     */
    default String affectedBusinessId() {
        return null;
    }

    default boolean requiresChoice() {
        return type().requiresChoice();
    }

    /**
     * Macro event hitting the whole portfolio or the holdco's cost of capital.
     */
    record MarketEvent(String id, EventType type, String title, String description) implements GameEvent {
    }

    /**
     * Immediate event on one business.
     */
    record PortfolioEvent(String id, EventType type, String title, String description,
                          String affectedBusinessId) implements GameEvent {
    }

    /**
     * A portfolio CEO introduces a seller. The deal joins the pipeline when the event is applied.
     */
    record ReferralDeal(String id, String title, String description, String affectedBusinessId)
        implements GameEvent {
        @Override
        public EventType type() {
            return EventType.PORTFOLIO_REFERRAL_DEAL;
        }
    }

    /**
     * Sector-specific shock. Hits every business in the sector when the definition says so,
     * otherwise only the affected business.
     */
    record SectorEvent(String id, String title, String description, EventDefinition definition,
                       String affectedBusinessId) implements GameEvent {
        @Override
        public EventType type() {
            return EventType.SECTOR_EVENT;
        }

        public String sectorId() {
            return definition.getSectorId();
        }
    }

    record QuietYear(String id) implements GameEvent {
        @Override
        public EventType type() {
            return EventType.GLOBAL_QUIET;
        }

        @Override
        public String title() {
            return "Quiet Year";
        }

        @Override
        public String description() {
            return "Markets are stable. Business as usual.";
        }
    }

    /**
     * A buyer offers to acquire one business outright.
     */
    record UnsolicitedOffer(String id, String title, String description, String affectedBusinessId,
                            long offerAmount, double offerMultiple, String buyerName, boolean strategic)
        implements GameEvent {
        @Override
        public EventType type() {
            return EventType.UNSOLICITED_OFFER;
        }
    }

    /**
     * Management asks for equity in the opco.
     */
    record EquityDemand(String id, String title, String description, String affectedBusinessId,
                        double sharesRequested) implements GameEvent {
        @Override
        public EventType type() {
            return EventType.PORTFOLIO_EQUITY_DEMAND;
        }
    }

    /**
     * A former owner offers to settle their seller note at a discount.
     */
    record SellerNoteRenegotiation(String id, String title, String description, String affectedBusinessId,
                                   long noteBalance, double discountRate, long payoffAmount)
        implements GameEvent {
        @Override
        public EventType type() {
            return EventType.PORTFOLIO_SELLER_NOTE_RENEGO;
        }
    }

    /**
     * The management team offers to buy the business.
     */
    record MboProposal(String id, String title, String description, String affectedBusinessId,
                       long offerAmount, double offerMultiple) implements GameEvent {
        @Override
        public EventType type() {
            return EventType.MBO_PROPOSAL;
        }
    }
}
