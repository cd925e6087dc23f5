package ai.authtrail.service;

import ai.authtrail.util.grpc.ClientHeaderInterceptor;
import ai.authtrail.util.grpc.GrpcUtils;
import ai.authtrail.v1.auth.AuthServiceGrpc;
import ai.authtrail.v1.auth.LAS;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.StatusRuntimeException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Calls {@code GetUserInfo} without credentials and with a valid token, logging what comes back.
 */
public class DemoClient {
    private static final Logger LOG = LogManager.getLogger(DemoClient.class);

    private static final Options OPTIONS = new Options();

    static {
        OPTIONS.addOption(new Option("a", "address", true, "AuthService address, host:port"));
        OPTIONS.addOption(new Option("t", "token", true, "Token for the authenticated call"));
        OPTIONS.addOption(new Option("h", "help", false, "Print help"));
    }

    public static void main(String[] args) throws InterruptedException {
        final CommandLineParser cliParser = new DefaultParser();
        final HelpFormatter cliHelp = new HelpFormatter();
        final CommandLine cmd;
        try {
            cmd = cliParser.parse(OPTIONS, args);
        } catch (ParseException e) {
            LOG.error(e.getMessage());
            cliHelp.printHelp("demo-client", OPTIONS);
            System.exit(-1);
            return;
        }

        if (cmd.hasOption('h')) {
            cliHelp.printHelp("demo-client", OPTIONS);
            return;
        }

        var address = cmd.getOptionValue('a', "localhost:50051");
        var token = cmd.getOptionValue('t', "valid-token");

        ManagedChannel channel = GrpcUtils.newGrpcChannel(address);
        try {
            var client = GrpcUtils.newBlockingClient(AuthServiceGrpc.newBlockingStub(channel), "DemoClient")
                .withInterceptors(ClientHeaderInterceptor.requestId(() -> UUID.randomUUID().toString()));
            var request = LAS.GetUserInfoRequest.newBuilder().setUserId("123").build();

            LOG.info("Call without credentials");
            call(client, request);

            LOG.info("Call with token '{}'", token);
            call(client.withInterceptors(ClientHeaderInterceptor.authorization(() -> token)), request);
        } finally {
            channel.shutdown();
            channel.awaitTermination(10, TimeUnit.SECONDS);
        }
    }

    static void call(AuthServiceGrpc.AuthServiceBlockingStub client, LAS.GetUserInfoRequest request) {
        try {
            var response = client.getUserInfo(request);
            LOG.info("Success: user_id={}, username={}, email={}",
                response.getUserId(), response.getUsername(), response.getEmail());
        } catch (StatusRuntimeException e) {
            LOG.info("Failed with status {}: {}", e.getStatus().getCode(), e.getStatus().getDescription());
            Metadata trailers = e.getTrailers();
            if (trailers == null || trailers.keys().isEmpty()) {
                LOG.info("No trailers received");
                return;
            }
            for (var key : trailers.keys()) {
                if (key.endsWith(Metadata.BINARY_HEADER_SUFFIX)) {
                    continue;
                }
                LOG.info("Trailer {}: {}", key,
                    trailers.getAll(Metadata.Key.of(key, Metadata.ASCII_STRING_MARSHALLER)));
            }
        }
    }
}
