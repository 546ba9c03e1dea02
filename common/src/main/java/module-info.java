// SPDX-License-Identifier: Apache-2.0
module org.hiero.merkle.common {
    exports org.hiero.merkle.common.hasher;
    exports org.hiero.merkle.common.logging;
    exports org.hiero.merkle.common.utils;

    requires transitive java.logging;
    requires static com.github.spotbugs.annotations;
}
