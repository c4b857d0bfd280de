package in.cep.application.port.output;

import in.cep.domain.liquidity.PayQuote;
import in.cep.domain.liquidity.PayResult;
import in.cep.domain.liquidity.QuotePayRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Lightning payment service backed by the liquidity pool.
 *
 * Futures complete exceptionally with {@link LiquidityException} when the call itself fails.
 * A completed {@link PayResult} with a non-succeeded status is a payment failure, not an exception.
 */
public interface LiquidityPayments {

    CompletableFuture<PayQuote> quotePay(QuotePayRequest request);

    CompletableFuture<PayResult> pay(String quoteId);
}
