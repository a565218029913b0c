package com.inviteledger.reconciler.resolver;

import java.util.Optional;

/**
 * Optional capability supplied by the chat layer. When no bean is present the resolver falls back
 * to the labels stored with invite records.
 */
public interface ChatProfileLookup {

  Optional<ChatProfile> lookup(String chatId);
}
