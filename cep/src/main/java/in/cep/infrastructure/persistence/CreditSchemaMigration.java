package in.cep.infrastructure.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Credit schema migration: creates the credit tables on startup if they are missing.
 *
 * Tables:
 * - credit_intents, credit_offers, credit_envelopes, credit_settlements (the protocol ledger)
 * - credit_underwriting_audits (one per offer)
 * - credit_receipts (unique per entity kind, entity id and schema)
 * - credit_liquidity_pay_events (Lightning payment attempts, feeds the health breakers)
 */
public final class CreditSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(CreditSchemaMigration.class);

    private static final Map<String, String> TABLES = new LinkedHashMap<>();
    static {
        TABLES.put("credit_intents", """
            CREATE TABLE credit_intents (
                intent_id TEXT PRIMARY KEY,
                idempotency_key TEXT NOT NULL,
                agent_id TEXT NOT NULL,
                scope_type TEXT NOT NULL,
                scope_id TEXT NOT NULL,
                max_sats BIGINT NOT NULL,
                exp TIMESTAMPTZ NOT NULL,
                policy_context JSONB NOT NULL DEFAULT '{}'::JSONB,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                request_fingerprint_sha256 TEXT NOT NULL
            );
            CREATE INDEX idx_credit_intents_agent_scope
                ON credit_intents (agent_id, scope_type, scope_id);
            """);

        TABLES.put("credit_offers", """
            CREATE TABLE credit_offers (
                offer_id TEXT PRIMARY KEY,
                agent_id TEXT NOT NULL,
                pool_id TEXT NOT NULL,
                intent_id TEXT,
                scope_type TEXT NOT NULL,
                scope_id TEXT NOT NULL,
                max_sats BIGINT NOT NULL,
                fee_bps INT NOT NULL,
                requires_verifier BOOL NOT NULL DEFAULT true,
                exp TIMESTAMPTZ NOT NULL,
                status TEXT NOT NULL,
                issued_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                request_fingerprint_sha256 TEXT NOT NULL
            );
            CREATE INDEX idx_credit_offers_agent_scope
                ON credit_offers (agent_id, scope_type, scope_id);
            """);

        TABLES.put("credit_underwriting_audits", """
            CREATE TABLE credit_underwriting_audits (
                offer_id TEXT PRIMARY KEY REFERENCES credit_offers(offer_id) ON DELETE CASCADE,
                agent_id TEXT NOT NULL,
                audit_json JSONB NOT NULL,
                audit_sha256 TEXT NOT NULL,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            );
            """);

        TABLES.put("credit_envelopes", """
            CREATE TABLE credit_envelopes (
                envelope_id TEXT PRIMARY KEY,
                offer_id TEXT NOT NULL REFERENCES credit_offers(offer_id) ON DELETE CASCADE,
                agent_id TEXT NOT NULL,
                pool_id TEXT NOT NULL,
                provider_id TEXT NOT NULL,
                scope_type TEXT NOT NULL,
                scope_id TEXT NOT NULL,
                max_sats BIGINT NOT NULL,
                fee_bps INT NOT NULL,
                exp TIMESTAMPTZ NOT NULL,
                status TEXT NOT NULL,
                issued_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                request_fingerprint_sha256 TEXT NOT NULL
            );
            CREATE INDEX idx_credit_envelopes_agent_status
                ON credit_envelopes (agent_id, status, issued_at DESC);
            """);

        TABLES.put("credit_settlements", """
            CREATE TABLE credit_settlements (
                settlement_id TEXT PRIMARY KEY,
                envelope_id TEXT NOT NULL REFERENCES credit_envelopes(envelope_id) ON DELETE CASCADE,
                agent_id TEXT NOT NULL,
                pool_id TEXT NOT NULL,
                provider_id TEXT NOT NULL,
                outcome TEXT NOT NULL,
                spent_sats BIGINT NOT NULL,
                fee_sats BIGINT NOT NULL,
                verification_passed BOOL NOT NULL,
                verification_receipt_sha256 TEXT NOT NULL,
                liquidity_receipt_sha256 TEXT,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                request_fingerprint_sha256 TEXT NOT NULL,
                UNIQUE (envelope_id)
            );
            CREATE INDEX idx_credit_settlements_created
                ON credit_settlements (created_at DESC);
            CREATE INDEX idx_credit_settlements_agent_created
                ON credit_settlements (agent_id, created_at DESC);
            """);

        TABLES.put("credit_receipts", """
            CREATE TABLE credit_receipts (
                receipt_id TEXT PRIMARY KEY,
                entity_kind TEXT NOT NULL,
                entity_id TEXT NOT NULL,
                schema TEXT NOT NULL,
                canonical_json_sha256 TEXT NOT NULL,
                signature_json JSONB,
                receipt_json JSONB NOT NULL DEFAULT '{}'::JSONB,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                UNIQUE (entity_kind, entity_id, schema)
            );
            """);

        TABLES.put("credit_liquidity_pay_events", """
            CREATE TABLE credit_liquidity_pay_events (
                event_id BIGSERIAL PRIMARY KEY,
                quote_id TEXT NOT NULL,
                envelope_id TEXT NOT NULL,
                status TEXT NOT NULL,
                error_code TEXT,
                amount_msats BIGINT NOT NULL,
                host TEXT NOT NULL,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            );
            CREATE INDEX idx_credit_liquidity_pay_events_created
                ON credit_liquidity_pay_events (created_at DESC);
            """);
    }

    private final DataSource dataSource;

    public CreditSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration - creates missing tables, leaves existing ones untouched.
     */
    public void migrate() {
        log.info("[CEP MIGRATION] Starting credit tables migration");

        try (Connection conn = dataSource.getConnection()) {
            for (Map.Entry<String, String> table : TABLES.entrySet()) {
                if (tableExists(conn, table.getKey())) {
                    log.info("[CEP MIGRATION] {} table already exists", table.getKey());
                    continue;
                }
                log.info("[CEP MIGRATION] Creating {} table...", table.getKey());
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute(table.getValue());
                }
                log.info("[CEP MIGRATION] ✓ {} table created", table.getKey());
            }
            log.info("[CEP MIGRATION] Migration completed successfully");
        } catch (Exception e) {
            log.error("[CEP MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Credit schema migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws Exception {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }
}
