package uma.model;

/**
 * A signature by another VASP over the same payload as the primary signature of a message.
 *
 * @param domain    where the backing VASP publishes its keys
 * @param signature hex encoded DER signature
 */
public record BackingSignature(
    String domain,
    String signature
) {

}
