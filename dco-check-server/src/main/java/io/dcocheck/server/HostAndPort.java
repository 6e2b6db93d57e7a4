package io.dcocheck.server;

/**
 * Listen address in {@code host:port} form.
 */
record HostAndPort(String host, int port) {

	/**
	 * Parse a {@code host:port} address.
	 * @throws IllegalStateException if the address is malformed
	 */
	static HostAndPort parse(String address) {
		int separator = address.lastIndexOf(':');
		if (separator <= 0 || separator == address.length() - 1) {
			throw new IllegalStateException("invalid server address '" + address + "': expected host:port");
		}
		String host = address.substring(0, separator);
		if (host.startsWith("[") && host.endsWith("]")) {
			host = host.substring(1, host.length() - 1);
		}
		try {
			int port = Integer.parseInt(address.substring(separator + 1));
			if (port < 0 || port > 65535) {
				throw new IllegalStateException("invalid server address '" + address + "': port out of range");
			}
			return new HostAndPort(host, port);
		}
		catch (NumberFormatException e) {
			throw new IllegalStateException("invalid server address '" + address + "': invalid port", e);
		}
	}

}
