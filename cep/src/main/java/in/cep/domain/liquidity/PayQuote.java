package in.cep.domain.liquidity;

public record PayQuote(String quoteId, long amountMsats, long feeMsats) {}
