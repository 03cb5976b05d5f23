package herald.engine.dispatch;

/**
 * External publishing collaborator for one platform.
 * Implementations report platform-side rejections as
 * {@link PublishResult#failure(String)}; anything they throw is treated as a
 * failed dispatch as well. The dispatcher bounds the call with its timeout and
 * interrupts the calling thread when it expires.
 */
@FunctionalInterface
public interface PlatformPublisher {

    PublishResult publish(PublishRequest request) throws InterruptedException;
}
