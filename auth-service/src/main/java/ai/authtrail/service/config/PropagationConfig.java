package ai.authtrail.service.config;

import ai.authtrail.util.grpc.trailers.HeaderToTrailerInterceptor;
import ai.authtrail.util.grpc.trailers.PropagationRule;
import ai.authtrail.util.grpc.trailers.PropagationRuleException;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Which captured response headers reach the trailers: {@code mode} is one of {@code all},
 * {@code allow} or {@code deny}; {@code headers} lists the keys for the last two.
 */
@Getter
@Setter
public class PropagationConfig {
    private String mode = "allow";
    private List<String> headers = new ArrayList<>(
        List.of(HeaderToTrailerInterceptor.WWW_AUTHENTICATE, HeaderToTrailerInterceptor.X_CUSTOM_TEST));
    private boolean mirrorToHeaders = false;

    public PropagationRule toRule() throws PropagationRuleException {
        var rule = PropagationRule.fromConfig(mode, headers);
        rule.validate();
        return rule;
    }

    public HeaderToTrailerInterceptor createInterceptor() throws PropagationRuleException {
        var interceptor = new HeaderToTrailerInterceptor(toRule());
        return mirrorToHeaders ? interceptor.mirroringToHeaders() : interceptor;
    }
}
