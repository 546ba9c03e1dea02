// SPDX-License-Identifier: Apache-2.0
module org.hiero.merkle.tools {
    exports org.hiero.merkle.tools;
    exports org.hiero.merkle.tools.commands;

    opens org.hiero.merkle.tools to
            info.picocli;
    opens org.hiero.merkle.tools.commands to
            info.picocli;

    requires org.hiero.merkle.common;
    requires org.hiero.merkle.tree;
    requires info.picocli;
    requires java.logging;
    requires static com.github.spotbugs.annotations;
}
