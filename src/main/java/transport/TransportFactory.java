package transport;

/**
 * Creates the socket of a connection attempt. Each attempt gets a fresh transport.
 */
@FunctionalInterface
public interface TransportFactory {

    Transport create(String url);
}
