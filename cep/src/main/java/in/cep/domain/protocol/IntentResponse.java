package in.cep.domain.protocol;

import in.cep.domain.credit.Intent;

public record IntentResponse(String schema, Intent intent) {}
