package com.platform.chaosmonkey.aws;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Lazy sequence of result pages from a token-paginated AWS API.
 * 
 * The first page is fetched with a null token; each later page with the token
 * returned by the previous one. The sequence ends once a page carries no next
 * token. Every call to {@link #iterator()} starts again from the first page, and
 * no page is fetched before it is asked for.
 *
 * @param <P> page type, e.g. a {@code DescribeAutoScalingGroupsResult}
 */
public class PagedResults<P> implements Iterable<P> {
    
    private final Function<String, P> fetchPage;
    private final Function<P, String> nextToken;
    
    public PagedResults(Function<String, P> fetchPage, Function<P, String> nextToken) {
        this.fetchPage = fetchPage;
        this.nextToken = nextToken;
    }
    
    @Override
    public Iterator<P> iterator() {
        return new PageIterator();
    }
    
    private class PageIterator implements Iterator<P> {
        
        private String token;
        private boolean exhausted;
        
        @Override
        public boolean hasNext() {
            return !exhausted;
        }
        
        @Override
        public P next() {
            if (exhausted) {
                throw new NoSuchElementException();
            }
            P page = fetchPage.apply(token);
            token = nextToken.apply(page);
            exhausted = token == null || token.isEmpty();
            return page;
        }
    }
}
