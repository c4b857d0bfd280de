package in.cep.domain.credit;

/**
 * Schema tags carried by requests, responses, receipts and audit records.
 */
public final class CreditSchemas {

    public static final String INTENT_REQUEST = "openagents.credit.intent_request.v1";
    public static final String INTENT_RESPONSE = "openagents.credit.intent_response.v1";
    public static final String OFFER_REQUEST = "openagents.credit.offer_request.v1";
    public static final String OFFER_RESPONSE = "openagents.credit.offer_response.v1";
    public static final String ENVELOPE_REQUEST = "openagents.credit.envelope_request.v1";
    public static final String ENVELOPE_RESPONSE = "openagents.credit.envelope_response.v1";
    public static final String SETTLE_REQUEST = "openagents.credit.settle_request.v1";
    public static final String SETTLE_RESPONSE = "openagents.credit.settle_response.v1";
    public static final String HEALTH_RESPONSE = "openagents.credit.health_response.v1";
    public static final String AGENT_EXPOSURE_RESPONSE = "openagents.credit.agent_exposure_response.v1";

    public static final String ENVELOPE_ISSUE_RECEIPT = "openagents.credit.envelope_issue_receipt.v1";
    public static final String ENVELOPE_SETTLEMENT_RECEIPT = "openagents.credit.envelope_settlement_receipt.v1";
    public static final String DEFAULT_NOTICE = "openagents.credit.default_notice.v1";

    public static final String UNDERWRITING_AUDIT = "openagents.credit.underwriting_audit.v1";
    public static final String UNDERWRITING_INPUTS = "openagents.credit.underwriting_inputs.v1";
    public static final String POLICY_CONTEXT = "openagents.credit.policy_context.v1";

    // Entity kinds under which receipts are stored
    public static final String ENTITY_ENVELOPE = "envelope";
    public static final String ENTITY_SETTLEMENT = "settlement";

    private CreditSchemas() {}
}
