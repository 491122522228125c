package domain.fingerprint;

/** Child of a {@link TokenGroup}: either a {@link Token} or a nested group. */
public interface TokenNode {

    void appendTo(StringBuilder out);
}
