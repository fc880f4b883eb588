package dev.containerizer.agent;

import static org.junit.jupiter.api.Assertions.*;

import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.Status;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AuthInterceptorTest {

    private AuthInterceptor interceptor;
    private ClosingCall<Object, Object> call;
    private int handled;

    @BeforeEach
    void setUp() {
        interceptor = new AuthInterceptor("agent-secret");
        call = new ClosingCall<>();
        handled = 0;
    }

    private ServerCallHandler<Object, Object> handler() {
        return (c, headers) -> {
            handled++;
            return new ServerCall.Listener<>() {};
        };
    }

    private static Metadata authorization(String value) {
        var headers = new Metadata();
        headers.put(AuthInterceptor.AUTHORIZATION_KEY, value);
        return headers;
    }

    @Test
    void rejectsCallWithoutHeader() {
        interceptor.interceptCall(call, new Metadata(), handler());

        assertEquals(Status.Code.UNAUTHENTICATED, call.status.getCode());
        assertEquals(0, handled);
    }

    @Test
    void rejectsWrongToken() {
        interceptor.interceptCall(call, authorization("Bearer agent-secret2"), handler());

        assertEquals(Status.Code.UNAUTHENTICATED, call.status.getCode());
        assertEquals(0, handled);
    }

    @Test
    void rejectsTokenWithoutBearerScheme() {
        interceptor.interceptCall(call, authorization("agent-secret"), handler());

        assertEquals(Status.Code.UNAUTHENTICATED, call.status.getCode());
        assertEquals(0, handled);
    }

    @Test
    void passesCallWithValidToken() {
        interceptor.interceptCall(call, authorization("Bearer agent-secret"), handler());

        assertNull(call.status);
        assertEquals(1, handled);
    }

    private static class ClosingCall<ReqT, RespT> extends ServerCall<ReqT, RespT> {
        Status status;

        @Override
        public void close(Status status, Metadata trailers) {
            this.status = status;
        }

        @Override public void request(int numMessages) {}
        @Override public void sendHeaders(Metadata headers) {}
        @Override public void sendMessage(RespT message) {}
        @Override public boolean isCancelled() { return false; }
        @Override public MethodDescriptor<ReqT, RespT> getMethodDescriptor() { return null; }
    }
}
