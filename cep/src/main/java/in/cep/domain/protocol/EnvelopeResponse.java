package in.cep.domain.protocol;

import in.cep.domain.credit.CreditReceipt;
import in.cep.domain.credit.Envelope;

public record EnvelopeResponse(String schema, Envelope envelope, CreditReceipt receipt) {}
