package in.cep.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import in.cep.application.port.output.CreditStore;
import in.cep.application.port.output.CreditStoreException;
import in.cep.domain.credit.CreditReceipt;
import in.cep.domain.credit.Envelope;
import in.cep.domain.credit.EnvelopeStatus;
import in.cep.domain.credit.Intent;
import in.cep.domain.credit.LiquidityPayEvent;
import in.cep.domain.credit.Offer;
import in.cep.domain.credit.OfferStatus;
import in.cep.domain.credit.OpenEnvelopeStats;
import in.cep.domain.credit.ReceiptSignature;
import in.cep.domain.credit.ScopeType;
import in.cep.domain.credit.Settlement;
import in.cep.domain.credit.SettlementOutcome;
import in.cep.domain.credit.SettlementWrite;
import in.cep.domain.credit.UnderwritingAuditRecord;
import in.cep.security.CanonicalJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of CreditStore.
 *
 * Create-or-get writes use INSERT ... ON CONFLICT DO NOTHING and then compare the stored
 * request fingerprint, so concurrent duplicates resolve inside the database.
 */
public final class PostgresCreditStore implements CreditStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresCreditStore.class);

    private final DataSource dataSource;

    public PostgresCreditStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    // ═══════════════════════════════════════════════════════════════
    // Intents
    // ═══════════════════════════════════════════════════════════════

    @Override
    public Intent createOrGetIntent(Intent intent, String fingerprint) {
        String sql = """
            INSERT INTO credit_intents (
                intent_id, idempotency_key, agent_id, scope_type, scope_id, max_sats, exp,
                policy_context, created_at, request_fingerprint_sha256
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?)
            ON CONFLICT (intent_id) DO NOTHING
            """;

        update("insert intent " + intent.intentId(), sql, ps -> {
            ps.setString(1, intent.intentId());
            ps.setString(2, intent.idempotencyKey());
            ps.setString(3, intent.agentId());
            ps.setString(4, intent.scopeType().wireValue());
            ps.setString(5, intent.scopeId());
            ps.setLong(6, intent.maxSats());
            ps.setTimestamp(7, Timestamp.from(intent.exp()));
            ps.setString(8, writeJson(intent.policyContext()));
            ps.setTimestamp(9, Timestamp.from(intent.createdAt()));
            ps.setString(10, fingerprint);
        });

        requireFingerprint("credit_intents", "intent_id", intent.intentId(), fingerprint, "intent");
        return getIntent(intent.intentId())
            .orElseThrow(() -> CreditStoreException.db("intent vanished after insert: " + intent.intentId(), null));
    }

    @Override
    public Optional<Intent> getIntent(String intentId) {
        String sql = """
            SELECT * FROM credit_intents
            WHERE intent_id = ?
            """;
        return queryOne("find intent " + intentId, sql, ps -> ps.setString(1, intentId), this::mapIntent);
    }

    // ═══════════════════════════════════════════════════════════════
    // Offers
    // ═══════════════════════════════════════════════════════════════

    @Override
    public Offer createOrGetOffer(Offer offer, String fingerprint) {
        String sql = """
            INSERT INTO credit_offers (
                offer_id, agent_id, pool_id, intent_id, scope_type, scope_id, max_sats, fee_bps,
                requires_verifier, exp, status, issued_at, request_fingerprint_sha256
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (offer_id) DO NOTHING
            """;

        update("insert offer " + offer.offerId(), sql, ps -> {
            ps.setString(1, offer.offerId());
            ps.setString(2, offer.agentId());
            ps.setString(3, offer.poolId());
            ps.setString(4, offer.intentId());
            ps.setString(5, offer.scopeType().wireValue());
            ps.setString(6, offer.scopeId());
            ps.setLong(7, offer.maxSats());
            ps.setInt(8, offer.feeBps());
            ps.setBoolean(9, offer.requiresVerifier());
            ps.setTimestamp(10, Timestamp.from(offer.exp()));
            ps.setString(11, offer.status().wireValue());
            ps.setTimestamp(12, Timestamp.from(offer.issuedAt()));
            ps.setString(13, fingerprint);
        });

        requireFingerprint("credit_offers", "offer_id", offer.offerId(), fingerprint, "offer");
        return getOffer(offer.offerId())
            .orElseThrow(() -> CreditStoreException.db("offer vanished after insert: " + offer.offerId(), null));
    }

    @Override
    public Optional<Offer> getOffer(String offerId) {
        String sql = """
            SELECT * FROM credit_offers
            WHERE offer_id = ?
            """;
        return queryOne("find offer " + offerId, sql, ps -> ps.setString(1, offerId), this::mapOffer);
    }

    @Override
    public void updateOfferStatus(String offerId, OfferStatus status) {
        String sql = """
            UPDATE credit_offers SET status = ?
            WHERE offer_id = ?
            """;
        int rows = update("update offer " + offerId, sql, ps -> {
            ps.setString(1, status.wireValue());
            ps.setString(2, offerId);
        });
        if (rows == 0) {
            throw CreditStoreException.notFound("offer not found: " + offerId);
        }
    }

    @Override
    public void putUnderwritingAudit(UnderwritingAuditRecord record) {
        String sql = """
            INSERT INTO credit_underwriting_audits (offer_id, agent_id, audit_json, audit_sha256, created_at)
            VALUES (?, ?, ?::jsonb, ?, ?)
            ON CONFLICT (offer_id) DO NOTHING
            """;
        int rows = update("insert underwriting audit " + record.offerId(), sql, ps -> {
            ps.setString(1, record.offerId());
            ps.setString(2, record.agentId());
            ps.setString(3, writeJson(record.auditJson()));
            ps.setString(4, record.auditSha256());
            ps.setTimestamp(5, Timestamp.from(record.createdAt()));
        });
        if (rows == 0) {
            throw CreditStoreException.conflict("underwriting audit already exists for offer " + record.offerId());
        }
    }

    @Override
    public Optional<UnderwritingAuditRecord> getUnderwritingAudit(String offerId) {
        String sql = """
            SELECT * FROM credit_underwriting_audits
            WHERE offer_id = ?
            """;
        return queryOne("find underwriting audit " + offerId, sql, ps -> ps.setString(1, offerId),
            rs -> new UnderwritingAuditRecord(
                rs.getString("offer_id"),
                rs.getString("agent_id"),
                readJson(rs.getString("audit_json")),
                rs.getString("audit_sha256"),
                rs.getTimestamp("created_at").toInstant()));
    }

    // ═══════════════════════════════════════════════════════════════
    // Envelopes
    // ═══════════════════════════════════════════════════════════════

    private static final String INSERT_ENVELOPE = """
        INSERT INTO credit_envelopes (
            envelope_id, offer_id, agent_id, pool_id, provider_id, scope_type, scope_id, max_sats,
            fee_bps, exp, status, issued_at, request_fingerprint_sha256
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (envelope_id) DO NOTHING
        """;

    @Override
    public Envelope createOrGetEnvelope(Envelope envelope, String fingerprint) {
        update("insert envelope " + envelope.envelopeId(), INSERT_ENVELOPE, ps -> bindEnvelope(ps, envelope, fingerprint));
        requireFingerprint("credit_envelopes", "envelope_id", envelope.envelopeId(), fingerprint, "envelope");
        return getEnvelope(envelope.envelopeId())
            .orElseThrow(() -> CreditStoreException.db("envelope vanished after insert: " + envelope.envelopeId(), null));
    }

    @Override
    public Envelope createEnvelopeAcceptingOffer(Envelope envelope, String fingerprint) {
        String acceptSql = """
            UPDATE credit_offers SET status = 'accepted'
            WHERE offer_id = ? AND status = 'offered'
            """;

        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);

            Optional<String> existing = storedFingerprint(conn, "credit_envelopes", "envelope_id", envelope.envelopeId());
            if (existing.isPresent()) {
                conn.rollback();
                return storedEnvelope(envelope.envelopeId(), existing.get(), fingerprint);
            }

            int accepted;
            try (PreparedStatement ps = conn.prepareStatement(acceptSql)) {
                ps.setString(1, envelope.offerId());
                accepted = ps.executeUpdate();
            }
            if (accepted == 0) {
                // An identical request may have committed while this one waited on the offer row lock.
                Optional<String> winner = storedFingerprint(conn, "credit_envelopes", "envelope_id", envelope.envelopeId());
                if (winner.isPresent()) {
                    conn.rollback();
                    return storedEnvelope(envelope.envelopeId(), winner.get(), fingerprint);
                }
                boolean offerExists = storedFingerprint(conn, "credit_offers", "offer_id", envelope.offerId()).isPresent();
                conn.rollback();
                if (!offerExists) {
                    throw CreditStoreException.notFound("offer not found: " + envelope.offerId());
                }
                throw CreditStoreException.conflict("offer already accepted");
            }

            int inserted;
            try (PreparedStatement ps = conn.prepareStatement(INSERT_ENVELOPE)) {
                bindEnvelope(ps, envelope, fingerprint);
                inserted = ps.executeUpdate();
            }
            if (inserted == 0) {
                // Envelope row written without the offer flip (best-effort acceptance path).
                conn.rollback();
                return createOrGetEnvelope(envelope, fingerprint);
            }

            conn.commit();
            return envelope;
        } catch (SQLException e) {
            rollbackQuietly(conn);
            log.error("Failed to accept offer {} for envelope {}: {}", envelope.offerId(), envelope.envelopeId(), e.getMessage());
            throw CreditStoreException.db("Failed to accept offer", e);
        } finally {
            closeQuietly(conn);
        }
    }

    private Envelope storedEnvelope(String envelopeId, String storedFingerprint, String fingerprint) {
        if (!storedFingerprint.equals(fingerprint)) {
            throw CreditStoreException.conflict("envelope " + envelopeId + " already exists with different parameters");
        }
        return getEnvelope(envelopeId)
            .orElseThrow(() -> CreditStoreException.db("envelope vanished after accept: " + envelopeId, null));
    }

    @Override
    public Optional<Envelope> getEnvelope(String envelopeId) {
        String sql = """
            SELECT * FROM credit_envelopes
            WHERE envelope_id = ?
            """;
        return queryOne("find envelope " + envelopeId, sql, ps -> ps.setString(1, envelopeId), this::mapEnvelope);
    }

    @Override
    public void updateEnvelopeStatus(String envelopeId, EnvelopeStatus status) {
        String sql = """
            UPDATE credit_envelopes SET status = ?
            WHERE envelope_id = ?
            """;
        int rows = update("update envelope " + envelopeId, sql, ps -> {
            ps.setString(1, status.wireValue());
            ps.setString(2, envelopeId);
        });
        if (rows == 0) {
            throw CreditStoreException.notFound("envelope not found: " + envelopeId);
        }
    }

    @Override
    public OpenEnvelopeStats getAgentOpenEnvelopeStats(String agentId, Instant now) {
        String sql = """
            SELECT COUNT(*) AS open_count, COALESCE(SUM(max_sats), 0) AS reserved_sats
            FROM credit_envelopes
            WHERE agent_id = ? AND status = 'accepted' AND exp > ?
            """;
        return queryOne("open envelope stats for " + agentId, sql, ps -> {
            ps.setString(1, agentId);
            ps.setTimestamp(2, Timestamp.from(now));
        }, PostgresCreditStore::mapOpenStats).orElse(OpenEnvelopeStats.empty());
    }

    @Override
    public OpenEnvelopeStats getGlobalOpenEnvelopeStats(Instant now) {
        String sql = """
            SELECT COUNT(*) AS open_count, COALESCE(SUM(max_sats), 0) AS reserved_sats
            FROM credit_envelopes
            WHERE status = 'accepted' AND exp > ?
            """;
        return queryOne("global open envelope stats", sql, ps -> ps.setTimestamp(1, Timestamp.from(now)),
            PostgresCreditStore::mapOpenStats).orElse(OpenEnvelopeStats.empty());
    }

    // ═══════════════════════════════════════════════════════════════
    // Settlements
    // ═══════════════════════════════════════════════════════════════

    @Override
    public SettlementWrite createOrGetSettlement(Settlement settlement, String fingerprint) {
        String sql = """
            INSERT INTO credit_settlements (
                settlement_id, envelope_id, agent_id, pool_id, provider_id, outcome, spent_sats, fee_sats,
                verification_passed, verification_receipt_sha256, liquidity_receipt_sha256, created_at,
                request_fingerprint_sha256
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT DO NOTHING
            """;

        int rows = update("insert settlement " + settlement.settlementId(), sql, ps -> {
            ps.setString(1, settlement.settlementId());
            ps.setString(2, settlement.envelopeId());
            ps.setString(3, settlement.agentId());
            ps.setString(4, settlement.poolId());
            ps.setString(5, settlement.providerId());
            ps.setString(6, settlement.outcome().wireValue());
            ps.setLong(7, settlement.spentSats());
            ps.setLong(8, settlement.feeSats());
            ps.setBoolean(9, settlement.verificationPassed());
            ps.setString(10, settlement.verificationReceiptSha256());
            ps.setString(11, settlement.liquidityReceiptSha256());
            ps.setTimestamp(12, Timestamp.from(settlement.createdAt()));
            ps.setString(13, fingerprint);
        });
        if (rows == 1) {
            return new SettlementWrite(settlement, true);
        }

        requireFingerprint("credit_settlements", "envelope_id", settlement.envelopeId(), fingerprint, null);
        Settlement existing = getSettlementByEnvelope(settlement.envelopeId())
            .orElseThrow(() -> CreditStoreException.db("settlement insert ignored without a stored row: "
                + settlement.settlementId(), null));
        return new SettlementWrite(existing, false);
    }

    @Override
    public Optional<Settlement> getSettlementByEnvelope(String envelopeId) {
        String sql = """
            SELECT * FROM credit_settlements
            WHERE envelope_id = ?
            """;
        return queryOne("find settlement for envelope " + envelopeId, sql, ps -> ps.setString(1, envelopeId),
            this::mapSettlement);
    }

    @Override
    public List<Settlement> listRecentSettlements(Instant since, int limit) {
        String sql = """
            SELECT * FROM credit_settlements
            WHERE created_at >= ?
            ORDER BY created_at DESC
            LIMIT ?
            """;
        return queryList("list recent settlements", sql, ps -> {
            ps.setTimestamp(1, Timestamp.from(since));
            ps.setInt(2, Math.max(limit, 0));
        }, this::mapSettlement);
    }

    @Override
    public List<Settlement> listRecentSettlementsForAgent(String agentId, Instant since, int limit) {
        String sql = """
            SELECT * FROM credit_settlements
            WHERE agent_id = ? AND created_at >= ?
            ORDER BY created_at DESC
            LIMIT ?
            """;
        return queryList("list recent settlements for " + agentId, sql, ps -> {
            ps.setString(1, agentId);
            ps.setTimestamp(2, Timestamp.from(since));
            ps.setInt(3, Math.max(limit, 0));
        }, this::mapSettlement);
    }

    // ═══════════════════════════════════════════════════════════════
    // Liquidity pay events
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void putLiquidityPayEvent(LiquidityPayEvent event) {
        String sql = """
            INSERT INTO credit_liquidity_pay_events (
                quote_id, envelope_id, status, error_code, amount_msats, host, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        update("insert pay event " + event.quoteId(), sql, ps -> {
            ps.setString(1, event.quoteId());
            ps.setString(2, event.envelopeId());
            ps.setString(3, event.status());
            ps.setString(4, event.errorCode());
            ps.setLong(5, event.amountMsats());
            ps.setString(6, event.host());
            ps.setTimestamp(7, Timestamp.from(event.createdAt()));
        });
    }

    @Override
    public List<LiquidityPayEvent> listRecentLiquidityPayEvents(Instant since, int limit) {
        String sql = """
            SELECT * FROM credit_liquidity_pay_events
            WHERE created_at >= ?
            ORDER BY created_at DESC
            LIMIT ?
            """;
        return queryList("list recent pay events", sql, ps -> {
            ps.setTimestamp(1, Timestamp.from(since));
            ps.setInt(2, Math.max(limit, 0));
        }, rs -> new LiquidityPayEvent(
            rs.getString("quote_id"),
            rs.getString("envelope_id"),
            rs.getString("status"),
            rs.getString("error_code"),
            rs.getLong("amount_msats"),
            rs.getString("host"),
            rs.getTimestamp("created_at").toInstant()));
    }

    // ═══════════════════════════════════════════════════════════════
    // Receipts
    // ═══════════════════════════════════════════════════════════════

    @Override
    public CreditReceipt putReceipt(String entityKind, String entityId, CreditReceipt receipt) {
        String sql = """
            INSERT INTO credit_receipts (
                receipt_id, entity_kind, entity_id, schema, canonical_json_sha256,
                signature_json, receipt_json, created_at
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?)
            ON CONFLICT DO NOTHING
            """;

        int rows = update("insert receipt " + receipt.receiptId(), sql, ps -> {
            ps.setString(1, receipt.receiptId());
            ps.setString(2, entityKind);
            ps.setString(3, entityId);
            ps.setString(4, receipt.schema());
            ps.setString(5, receipt.canonicalJsonSha256());
            ps.setString(6, receipt.signature() == null ? null : writeJson(receipt.signature()));
            ps.setString(7, writeJson(receipt.payload()));
            ps.setTimestamp(8, Timestamp.from(receipt.createdAt()));
        });
        if (rows == 1) {
            return receipt;
        }

        CreditReceipt existing = getReceipt(entityKind, entityId, receipt.schema())
            .orElseThrow(() -> CreditStoreException.conflict("receipt " + receipt.receiptId()
                + " already stored for another entity"));
        if (!existing.canonicalJsonSha256().equals(receipt.canonicalJsonSha256())) {
            throw CreditStoreException.conflict("receipt already exists for " + entityKind + " " + entityId
                + " with a different digest");
        }
        return existing;
    }

    @Override
    public Optional<CreditReceipt> getReceipt(String entityKind, String entityId, String schema) {
        String sql = """
            SELECT * FROM credit_receipts
            WHERE entity_kind = ? AND entity_id = ? AND schema = ?
            """;
        return queryOne("find receipt " + entityKind + "/" + entityId, sql, ps -> {
            ps.setString(1, entityKind);
            ps.setString(2, entityId);
            ps.setString(3, schema);
        }, rs -> {
            String signatureJson = rs.getString("signature_json");
            return new CreditReceipt(
                rs.getString("receipt_id"),
                rs.getString("schema"),
                rs.getString("canonical_json_sha256"),
                signatureJson == null ? null : readValue(signatureJson, ReceiptSignature.class),
                readJson(rs.getString("receipt_json")),
                rs.getTimestamp("created_at").toInstant());
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // JDBC helpers
    // ═══════════════════════════════════════════════════════════════

    private int update(String what, String sql, Binder binder) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to {}: {}", what, e.getMessage());
            throw CreditStoreException.db("Failed to " + what, e);
        }
    }

    private <T> Optional<T> queryOne(String what, String sql, Binder binder, RowMapper<T> mapper) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapper.map(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to {}: {}", what, e.getMessage());
            throw CreditStoreException.db("Failed to " + what, e);
        }
        return Optional.empty();
    }

    private <T> List<T> queryList(String what, String sql, Binder binder, RowMapper<T> mapper) {
        List<T> rows = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to {}: {}", what, e.getMessage());
            throw CreditStoreException.db("Failed to " + what, e);
        }
        return rows;
    }

    /**
     * After an ignored insert, the stored row must carry the same fingerprint.
     *
     * @param kind entity name for the conflict message, or null for the settlement wording
     */
    private void requireFingerprint(String table, String keyColumn, String key, String fingerprint, String kind) {
        Optional<String> stored;
        try (Connection conn = dataSource.getConnection()) {
            stored = storedFingerprint(conn, table, keyColumn, key);
        } catch (SQLException e) {
            log.error("Failed to read fingerprint from {} for {}: {}", table, key, e.getMessage());
            throw CreditStoreException.db("Failed to read fingerprint", e);
        }
        if (stored.isEmpty()) {
            throw CreditStoreException.db("row missing after insert into " + table + ": " + key, null);
        }
        if (!stored.get().equals(fingerprint)) {
            throw CreditStoreException.conflict(kind == null
                ? "settlement already exists for envelope with different parameters"
                : kind + " " + key + " already exists with different parameters");
        }
    }

    private static Optional<String> storedFingerprint(Connection conn, String table, String keyColumn, String key)
            throws SQLException {
        String sql = "SELECT request_fingerprint_sha256 FROM " + table + " WHERE " + keyColumn + " = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        }
    }

    private static void bindEnvelope(PreparedStatement ps, Envelope envelope, String fingerprint) throws SQLException {
        ps.setString(1, envelope.envelopeId());
        ps.setString(2, envelope.offerId());
        ps.setString(3, envelope.agentId());
        ps.setString(4, envelope.poolId());
        ps.setString(5, envelope.providerId());
        ps.setString(6, envelope.scopeType().wireValue());
        ps.setString(7, envelope.scopeId());
        ps.setLong(8, envelope.maxSats());
        ps.setInt(9, envelope.feeBps());
        ps.setTimestamp(10, Timestamp.from(envelope.exp()));
        ps.setString(11, envelope.status().wireValue());
        ps.setTimestamp(12, Timestamp.from(envelope.issuedAt()));
        ps.setString(13, fingerprint);
    }

    private static void rollbackQuietly(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }

    private static void closeQuietly(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.setAutoCommit(true);
            conn.close();
        } catch (SQLException e) {
            log.warn("Failed to release connection: {}", e.getMessage());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Row mapping
    // ═══════════════════════════════════════════════════════════════

    private Intent mapIntent(ResultSet rs) throws SQLException {
        return new Intent(
            rs.getString("intent_id"),
            rs.getString("idempotency_key"),
            rs.getString("agent_id"),
            scopeType(rs.getString("scope_type")),
            rs.getString("scope_id"),
            rs.getLong("max_sats"),
            rs.getTimestamp("exp").toInstant(),
            readJson(rs.getString("policy_context")),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private Offer mapOffer(ResultSet rs) throws SQLException {
        return new Offer(
            rs.getString("offer_id"),
            rs.getString("agent_id"),
            rs.getString("pool_id"),
            rs.getString("intent_id"),
            scopeType(rs.getString("scope_type")),
            rs.getString("scope_id"),
            rs.getLong("max_sats"),
            rs.getInt("fee_bps"),
            rs.getBoolean("requires_verifier"),
            rs.getTimestamp("exp").toInstant(),
            OfferStatus.fromWire(rs.getString("status")),
            rs.getTimestamp("issued_at").toInstant()
        );
    }

    private Envelope mapEnvelope(ResultSet rs) throws SQLException {
        return new Envelope(
            rs.getString("envelope_id"),
            rs.getString("offer_id"),
            rs.getString("agent_id"),
            rs.getString("pool_id"),
            rs.getString("provider_id"),
            scopeType(rs.getString("scope_type")),
            rs.getString("scope_id"),
            rs.getLong("max_sats"),
            rs.getInt("fee_bps"),
            rs.getTimestamp("exp").toInstant(),
            EnvelopeStatus.fromWire(rs.getString("status")),
            rs.getTimestamp("issued_at").toInstant()
        );
    }

    private Settlement mapSettlement(ResultSet rs) throws SQLException {
        return new Settlement(
            rs.getString("settlement_id"),
            rs.getString("envelope_id"),
            rs.getString("agent_id"),
            rs.getString("pool_id"),
            rs.getString("provider_id"),
            SettlementOutcome.fromWire(rs.getString("outcome")),
            rs.getLong("spent_sats"),
            rs.getLong("fee_sats"),
            rs.getBoolean("verification_passed"),
            rs.getString("verification_receipt_sha256"),
            rs.getString("liquidity_receipt_sha256"),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private static OpenEnvelopeStats mapOpenStats(ResultSet rs) throws SQLException {
        return new OpenEnvelopeStats(rs.getLong("open_count"), rs.getLong("reserved_sats"));
    }

    private static ScopeType scopeType(String value) {
        ScopeType type = ScopeType.fromWire(value);
        if (type == null) {
            throw CreditStoreException.db("unknown scope_type in store: " + value, null);
        }
        return type;
    }

    private static String writeJson(Object value) {
        try {
            return CanonicalJson.mapper().writeValueAsString(value == null ? CanonicalJson.object() : value);
        } catch (JsonProcessingException e) {
            throw CreditStoreException.db("Failed to serialize JSON column", e);
        }
    }

    private static JsonNode readJson(String json) {
        return readValue(json == null ? "{}" : json, JsonNode.class);
    }

    private static <T> T readValue(String json, Class<T> type) {
        try {
            return CanonicalJson.mapper().readValue(json, type);
        } catch (JsonProcessingException e) {
            throw CreditStoreException.db("Failed to parse JSON column", e);
        }
    }
}
