package ai.authtrail.service.grpc;

import ai.authtrail.auth.grpc.context.AuthenticationContext;
import ai.authtrail.v1.auth.AuthServiceGrpc;
import ai.authtrail.v1.auth.LAS;
import io.grpc.stub.StreamObserver;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

@Singleton
public class AuthService extends AuthServiceGrpc.AuthServiceImplBase {
    private static final Logger LOG = LogManager.getLogger(AuthService.class);

    public static final String EMAIL_DOMAIN = "example.com";

    @Override
    public void getUserInfo(LAS.GetUserInfoRequest request, StreamObserver<LAS.GetUserInfoResponse> response) {
        var subject = AuthenticationContext.currentSubject();
        LOG.info("Get user info, requested id: '{}', subject: {}", request.getUserId(), subject.str());

        var userId = subject.id().isEmpty() ? request.getUserId() : subject.id();

        response.onNext(LAS.GetUserInfoResponse.newBuilder()
            .setUserId(userId)
            .setUsername(subject.name())
            .setEmail(subject.name() + "@" + EMAIL_DOMAIN)
            .build());
        response.onCompleted();
    }
}
