package net.ipip.ipdb;

/**
 * {@code CacheKey} is used as a key in the lookup cache. The same address and
 * language are cached separately for each form of result.
 *
 * @param address  the address as given by the caller
 * @param language the requested language
 * @param type     the class of the result
 */
public record CacheKey(String address, String language, Class<?> type) {
}
