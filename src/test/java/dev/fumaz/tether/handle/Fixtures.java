package dev.fumaz.tether.handle;

import dev.fumaz.tether.ownership.Owned;
import dev.fumaz.tether.ownership.Ownership;
import dev.fumaz.tether.ownership.SharedFromThis;

final class Fixtures {

    private Fixtures() {
    }

    interface Control {
    }

    interface Focusable extends Control {
    }

    interface Clickable extends Control {
    }

    static class Widget extends WeakSubject<Widget> {
        Widget(HandleOptions options) {
            super(Widget.class, options);
        }

        void hijack() {
            detachFromSequence();
        }

        void revoke() {
            invalidateWeakHandles();
        }
    }

    static final class Button extends Widget implements Focusable, Clickable {
        Button(HandleOptions options) {
            super(options);
        }

        static Owned<Button> create(HandleOptions options) {
            return Ownership.create(() -> new Button(options));
        }
    }

    static final class Label extends Widget {
        Label(HandleOptions options) {
            super(options);
        }

        static Owned<Label> create(HandleOptions options) {
            return Ownership.create(() -> new Label(options));
        }
    }

    static final class Gadget extends WeakSubject<Gadget> {
        private Gadget(HandleOptions options) {
            super(Gadget.class, options);
        }

        static Owned<Gadget> create(HandleOptions options) {
            return Ownership.create(() -> new Gadget(options));
        }
    }

    /**
     * A subject that embeds a factory instead of extending {@link WeakSubject}.
     */
    static final class Document extends SharedFromThis<Document> {
        final WeakHandleFactory<Document> handles;

        private Document(HandleOptions options) {
            this.handles = new WeakHandleFactory<>(Document.class, this, options);
        }

        static Owned<Document> create(HandleOptions options) {
            return Ownership.create(() -> new Document(options));
        }

        static Document unowned(HandleOptions options) {
            return new Document(options);
        }
    }
}
