package edu.uwed.ldapAuth.ldap;

import com.unboundid.ldap.sdk.SearchResultEntry;
import com.unboundid.ldap.sdk.SearchResultListener;
import com.unboundid.ldap.sdk.SearchResultReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts entries as they stream in. The entry count reported with the search result is not
 * relied on.
 */
public class EntryCountingSearchResultListener implements SearchResultListener {

    private static final Logger logger = LoggerFactory.getLogger(EntryCountingSearchResultListener.class);

    private final AtomicInteger entryCount = new AtomicInteger();
    private final AtomicInteger referenceCount = new AtomicInteger();

    @Override
    public void searchEntryReturned(SearchResultEntry searchEntry) {
        entryCount.incrementAndGet();
    }

    @Override
    public void searchReferenceReturned(SearchResultReference searchReference) {
        referenceCount.incrementAndGet();
        logger.debug("Search reference received, URLs: {}", (Object) searchReference.getReferralURLs());
    }

    public int getEntryCount() {
        return entryCount.get();
    }

    public int getReferenceCount() {
        return referenceCount.get();
    }
}
