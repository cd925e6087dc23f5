package ai.authtrail.logs;

public final class LogContextKey {

    public static final String REQUEST_ID = "rid";
    public static final String CALL_ID = "call_id";

    public static final String SUBJECT = "subj";

    public static final String METHOD = "method";


    private LogContextKey() { }
}
