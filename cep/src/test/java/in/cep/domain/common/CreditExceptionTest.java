package in.cep.domain.common;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class CreditExceptionTest {

    @Test
    void wireCodes_areStable() {
        assertEquals("invalid_request", CreditErrorCode.INVALID_REQUEST.wireCode());
        assertEquals("not_found", CreditErrorCode.NOT_FOUND.wireCode());
        assertEquals("conflict", CreditErrorCode.CONFLICT.wireCode());
        assertEquals("dependency_unavailable", CreditErrorCode.DEPENDENCY_UNAVAILABLE.wireCode());
        assertEquals("internal_error", CreditErrorCode.INTERNAL.wireCode());
    }

    @Test
    void onlyDependencyFailuresAreRetryable() {
        assertTrue(CreditException.dependencyUnavailable("breaker").isRetryable());
        assertFalse(CreditException.conflict("dup").isRetryable());
        assertFalse(CreditException.internal("boom", null).isRetryable());
    }

    @Test
    void unwrap_recoversFromFutureFailures() {
        CreditException cause = CreditException.notFound("offer not found");
        CompletableFuture<Object> failed = CompletableFuture.failedFuture(cause);

        ExecutionException viaGet = assertThrows(ExecutionException.class, failed::get);
        CompletionException viaJoin = assertThrows(CompletionException.class, failed::join);

        assertSame(cause, CreditException.unwrap(viaGet));
        assertSame(cause, CreditException.unwrap(viaJoin));
        assertNull(CreditException.unwrap(new IllegalStateException("other")));
    }
}
