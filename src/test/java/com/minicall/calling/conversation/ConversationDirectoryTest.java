package com.minicall.calling.conversation;

import com.minicall.calling.model.CallMode;
import com.minicall.config.CallingProperties;
import com.minicall.config.ConversationCacheProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationDirectoryTest {

    @Test
    void tooBigToRingShouldOnlyApplyToLargeGroups() {
        ConversationDirectory directory = new ConversationDirectory(new ConversationCacheProperties(),
                new CallingProperties(null, null, 10));

        directory.put(new ConversationInfo("small", CallMode.GROUP, 9, false, false));
        directory.put(new ConversationInfo("big", CallMode.GROUP, 10, false, false));
        directory.put(new ConversationInfo("dm", CallMode.DIRECT, 2, false, false));

        assertFalse(directory.isTooBigToRing("small"));
        assertTrue(directory.isTooBigToRing("big"));
        assertFalse(directory.isTooBigToRing("dm"));
        assertFalse(directory.isTooBigToRing("unknown"));
    }

    @Test
    void removeShouldForgetConversation() {
        ConversationDirectory directory = new ConversationDirectory(new ConversationCacheProperties(), null);
        directory.put(new ConversationInfo("g1", CallMode.GROUP, 3, false, false));
        assertEquals(CallMode.GROUP, directory.getCallMode("g1"));

        directory.remove("g1");

        assertNull(directory.get("g1"));
        assertNull(directory.getCallMode("g1"));
        assertNull(directory.get(null));
    }

    @Test
    void syncedConversationsShouldNeverBeEvicted() {
        ConversationCacheProperties cacheProps = new ConversationCacheProperties();
        cacheProps.setInitialCapacity(2);
        ConversationDirectory directory = new ConversationDirectory(cacheProps, new CallingProperties("me", true, 16));

        for (int i = 0; i < 50; i++) {
            directory.put(new ConversationInfo("g" + i, CallMode.GROUP, 3, false, false));
        }

        assertEquals(50, directory.size());
        for (int i = 0; i < 50; i++) {
            assertEquals(CallMode.GROUP, directory.getCallMode("g" + i));
        }
    }

    @Test
    void defaultLimitShouldBeSixteenMembers() {
        ConversationDirectory directory = new ConversationDirectory(new ConversationCacheProperties(),
                new CallingProperties("me", true, null));

        assertFalse(directory.isTooBigToRing(new ConversationInfo("g", CallMode.GROUP, 15, false, false)));
        assertTrue(directory.isTooBigToRing(new ConversationInfo("g", CallMode.GROUP, 16, false, false)));
    }
}
