package dev.containerizer.agent;

import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Rejects calls that do not carry {@code Authorization: Bearer <token>}.
 */
public class AuthInterceptor implements ServerInterceptor {

    static final Metadata.Key<String> AUTHORIZATION_KEY =
            Metadata.Key.of("Authorization", Metadata.ASCII_STRING_MARSHALLER);

    private final byte[] expectedToken;

    public AuthInterceptor(String secret) {
        this.expectedToken = ("Bearer " + secret).getBytes(StandardCharsets.US_ASCII);
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call,
            Metadata headers,
            ServerCallHandler<ReqT, RespT> next) {
        String authHeader = headers.get(AUTHORIZATION_KEY);

        if (authHeader == null
                || !MessageDigest.isEqual(authHeader.getBytes(StandardCharsets.US_ASCII), expectedToken)) {
            call.close(Status.UNAUTHENTICATED.withDescription("Invalid or missing authorization token"), new Metadata());
            return new ServerCall.Listener<>() {};
        }

        return Contexts.interceptCall(Context.current(), call, headers, next);
    }
}
