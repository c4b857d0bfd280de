package in.cep.application.port.output;

import java.util.OptionalLong;

/**
 * Extracts the amount from a Lightning invoice.
 */
public interface InvoiceAmountDecoder {

    /**
     * @return amount in millisatoshis, or empty when the invoice carries no amount or cannot be read
     */
    OptionalLong amountMsats(String invoice);
}
