package edu.uwed.ldapAuth.ldap;

import com.unboundid.ldap.sdk.LDAPException;
import com.unboundid.ldap.sdk.ResultCode;
import lombok.Getter;
import org.springframework.security.core.AuthenticationException;

/**
 * Classified failure of an authentication attempt. The {@link FailureKind} is kept for logging and
 * for callers that need to tell misconfiguration from bad credentials; the message is what the
 * end user sees.
 */
@Getter
public class DirectoryAuthenticationException extends AuthenticationException {

    public static final String SERVER_FAILURE_MESSAGE = "Failed to Connect or Bind to server.";
    public static final String INVALID_LOGIN_MESSAGE = "Error completing LDAP login. Invalid username or password.";

    public enum FailureKind {
        CONNECTION_FAILURE, BIND_FAILURE, SEARCH_FAILURE, USER_NOT_FOUND, INVALID_CREDENTIALS, PROVISIONING_DISABLED
    }

    public enum Phase {
        LOCATE, VERIFY, ADMIN_CHECK, RECONCILE
    }

    private final FailureKind kind;
    private final Phase phase;

    public DirectoryAuthenticationException(FailureKind kind, Phase phase, String message) {
        super(message);
        this.kind = kind;
        this.phase = phase;
    }

    public DirectoryAuthenticationException(FailureKind kind, Phase phase, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.phase = phase;
    }

    /**
     * Classifies a failure to connect or bind. Use {@link #fromSearch} once the connection is bound.
     */
    public static DirectoryAuthenticationException from(LDAPException e, Phase phase, String message) {
        FailureKind kind = isCredentialFailure(e.getResultCode())
                ? FailureKind.BIND_FAILURE
                : FailureKind.CONNECTION_FAILURE;
        return new DirectoryAuthenticationException(kind, phase, message, e);
    }

    /**
     * Classifies a failure of a search on an already bound connection. Access or filter errors are
     * search failures, never bind failures.
     */
    public static DirectoryAuthenticationException fromSearch(LDAPException e, Phase phase, String message) {
        FailureKind kind = isConnectionLost(e.getResultCode())
                ? FailureKind.CONNECTION_FAILURE
                : FailureKind.SEARCH_FAILURE;
        return new DirectoryAuthenticationException(kind, phase, message, e);
    }

    public static boolean isConnectionLost(ResultCode resultCode) {
        return ResultCode.SERVER_DOWN.equals(resultCode)
                || ResultCode.CONNECT_ERROR.equals(resultCode)
                || ResultCode.TIMEOUT.equals(resultCode)
                || ResultCode.UNAVAILABLE.equals(resultCode)
                || ResultCode.BUSY.equals(resultCode);
    }

    // PARAM_ERROR is raised client side for a DN bound with an empty password
    public static boolean isCredentialFailure(ResultCode resultCode) {
        return ResultCode.INVALID_CREDENTIALS.equals(resultCode)
                || ResultCode.INAPPROPRIATE_AUTHENTICATION.equals(resultCode)
                || ResultCode.INSUFFICIENT_ACCESS_RIGHTS.equals(resultCode)
                || ResultCode.UNWILLING_TO_PERFORM.equals(resultCode)
                || ResultCode.INVALID_DN_SYNTAX.equals(resultCode)
                || ResultCode.PARAM_ERROR.equals(resultCode);
    }
}
