package in.cep.infrastructure.lightning;

import in.cep.application.port.output.InvoiceAmountDecoder;

import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the amount from the human-readable part of a BOLT11 invoice.
 *
 * The HRP is everything before the last '1' separator: {@code ln<network><amount><multiplier>}.
 * Only the amount is decoded; the checksum and tagged fields are left to the payer.
 */
public final class Bolt11AmountDecoder implements InvoiceAmountDecoder {

    private static final Pattern HRP = Pattern.compile("^ln([a-z]+?)(\\d+)([munp]?)$");

    // Millisatoshis per unit of the HRP amount (1 BTC = 100_000_000_000 msat)
    private static final long MSAT_PER_BTC = 100_000_000_000L;

    @Override
    public OptionalLong amountMsats(String invoice) {
        if (invoice == null) {
            return OptionalLong.empty();
        }
        String normalized = invoice.trim().toLowerCase();
        if (normalized.startsWith("lightning:")) {
            normalized = normalized.substring("lightning:".length());
        }
        int separator = normalized.lastIndexOf('1');
        if (separator <= 2) {
            return OptionalLong.empty();
        }

        Matcher m = HRP.matcher(normalized.substring(0, separator));
        if (!m.matches()) {
            return OptionalLong.empty();
        }

        String digits = m.group(2);
        if (digits.length() > 1 && digits.startsWith("0")) {
            return OptionalLong.empty();
        }
        try {
            long amount = Long.parseLong(digits);
            return toMsats(amount, m.group(3));
        } catch (NumberFormatException | ArithmeticException e) {
            return OptionalLong.empty();
        }
    }

    private static OptionalLong toMsats(long amount, String multiplier) {
        return switch (multiplier) {
            case "m" -> OptionalLong.of(Math.multiplyExact(amount, MSAT_PER_BTC / 1_000));
            case "u" -> OptionalLong.of(Math.multiplyExact(amount, MSAT_PER_BTC / 1_000_000));
            case "n" -> OptionalLong.of(Math.multiplyExact(amount, MSAT_PER_BTC / 1_000_000_000));
            // pico-BTC is a tenth of a millisatoshi
            case "p" -> amount % 10 == 0 ? OptionalLong.of(amount / 10) : OptionalLong.empty();
            default -> OptionalLong.of(Math.multiplyExact(amount, MSAT_PER_BTC));
        };
    }
}
