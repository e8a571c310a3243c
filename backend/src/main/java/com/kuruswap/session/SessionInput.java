package com.kuruswap.session;

/**
 * Input delivered by the messaging front end: a menu action, free text, a confirmation or a cancel.
 */
public interface SessionInput {

    record StartCreateWallet() implements SessionInput {
    }

    record StartImportWallet() implements SessionInput {
    }

    record StartSwap() implements SessionInput {
    }

    record TextEntered(String text) implements SessionInput {

        @Override
        public String toString() {
            return "TextEntered[length=" + (text == null ? 0 : text.length()) + "]";
        }
    }

    record ConfirmSwap() implements SessionInput {
    }

    record Cancel() implements SessionInput {
    }
}
