package in.cep.domain.credit;

/**
 * Result of an idempotent settlement write: the stored row and whether this call created it.
 */
public record SettlementWrite(Settlement settlement, boolean created) {}
