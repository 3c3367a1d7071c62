package nl.bytesoflife.wirebom.parser;

import java.util.List;
import java.util.Optional;

public sealed interface SNode permits SNode.SAtom, SNode.SList {

    record SAtom(String value) implements SNode {
        @Override
        public String toString() {
            return value;
        }
    }

    record SList(List<SNode> children) implements SNode {

        /**
         * The leading atom of the list, or an empty string when the list is empty
         * or starts with a nested list.
         */
        public String tag() {
            if (children.isEmpty()) return "";
            SNode first = children.get(0);
            if (first instanceof SAtom atom) {
                return atom.value();
            }
            return "";
        }

        /**
         * The atom at the given index, or an empty string when absent or not an atom.
         */
        public String atom(int index) {
            if (index >= children.size()) return "";
            SNode node = children.get(index);
            if (node instanceof SAtom atom) {
                return atom.value();
            }
            return "";
        }

        public Optional<SList> child(String tag) {
            for (SNode node : children) {
                if (node instanceof SList list && tag.equals(list.tag())) {
                    return Optional.of(list);
                }
            }
            return Optional.empty();
        }

        public List<SList> children(String tag) {
            return children.stream()
                    .filter(n -> n instanceof SList list && tag.equals(list.tag()))
                    .map(n -> (SList) n)
                    .toList();
        }

        /**
         * Value of a {@code (property "Name" "Value" ...)} child, if present.
         */
        public Optional<String> property(String name) {
            for (SList prop : children("property")) {
                if (name.equals(prop.atom(1))) {
                    return Optional.of(prop.atom(2));
                }
            }
            return Optional.empty();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(children.get(i));
            }
            sb.append(')');
            return sb.toString();
        }
    }
}
