package alertquery.filter;

import alertquery.model.Alert;
import alertquery.model.ResourceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertKeysTest {

    private final AlertKeys keys = new AlertKeys();

    @Nested
    @DisplayName("key layout")
    class Layout {
        @Test
        void data_key_orders_segments_like_query_filters() {
            Alert alert = Alert.builder().resource(ResourceType.VOLUME).alertType(26).resourceId("vol-1").build();
            assertThat(keys.keyOf(alert)).isEqualTo("alerts/Volume/1a/vol-1/data");
        }

        @Test
        void negative_alert_type_keeps_sign() {
            assertThat(keys.dataKey(ResourceType.NODE, -5, "n1")).isEqualTo("alerts/Node/-5/n1/data");
        }

        @Test
        void root_is_normalized() {
            AlertKeys custom = new AlertKeys("/cluster-1/alerts/");
            assertThat(custom.getRoot()).isEqualTo("cluster-1/alerts");
            assertThat(custom.fromFilters()).containsExactly("cluster-1/alerts");
        }

        @Test
        void blank_root_is_rejected() {
            assertThatThrownBy(() -> new AlertKeys("/")).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void ancestor_check_respects_segment_boundaries() {
            assertThat(AlertKeys.isAncestor("alerts/Volume", "alerts/Volume/5")).isTrue();
            assertThat(AlertKeys.isAncestor("alerts/Volume", "alerts/Volumes/5")).isFalse();
            assertThat(AlertKeys.isAncestor("alerts/Volume", "alerts/Volume")).isFalse();
            assertThat(AlertKeys.isAncestor("alerts/Volume/5", "alerts/Volume")).isFalse();
        }
    }

    @Nested
    @DisplayName("derivation")
    class Derivation {
        @Test
        void no_filters_scan_everything() {
            assertThat(keys.fromFilters()).containsExactly("alerts");
            assertThat(keys.fromFilters(Collections.emptyList())).containsExactly("alerts");
        }

        @Test
        void resource_type_only() {
            assertThat(keys.fromFilters(AlertFilter.queryResourceType(ResourceType.VOLUME)))
                    .containsExactly("alerts/Volume");
        }

        @Test
        void alert_type() {
            assertThat(keys.fromFilters(AlertFilter.queryAlertType(5, ResourceType.VOLUME)))
                    .containsExactly("alerts/Volume/5");
        }

        @Test
        void resource_id() {
            assertThat(keys.fromFilters(AlertFilter.queryResourceId("vol-1", ResourceType.VOLUME, 255)))
                    .containsExactly("alerts/Volume/ff/vol-1");
        }

        @Test
        void general_key_wins_over_its_descendants() {
            Set<String> derived = keys.fromFilters(
                    AlertFilter.queryAlertType(5, ResourceType.VOLUME),
                    AlertFilter.queryResourceId("vol-1", ResourceType.VOLUME, 5),
                    AlertFilter.queryResourceType(ResourceType.VOLUME));
            assertThat(derived).containsExactly("alerts/Volume");
        }

        @Test
        void independent_subtrees_are_all_kept() {
            Set<String> derived = keys.fromFilters(
                    AlertFilter.queryAlertType(1, ResourceType.VOLUME),
                    AlertFilter.queryAlertType(2, ResourceType.VOLUME),
                    AlertFilter.queryResourceId("n1", ResourceType.NODE, 3),
                    AlertFilter.queryResourceId("vol-9", ResourceType.VOLUME, 2));
            assertThat(derived).containsExactly("alerts/Node/3/n1", "alerts/Volume/1", "alerts/Volume/2");
        }

        @Test
        void duplicate_filters_collapse() {
            assertThat(keys.fromFilters(
                    AlertFilter.queryAlertType(5, ResourceType.VOLUME),
                    AlertFilter.queryAlertType(5, ResourceType.VOLUME)))
                    .containsExactly("alerts/Volume/5");
        }

        @Test
        void custom_filter_never_narrows() {
            assertThat(keys.fromFilters(AlertFilter.custom(a -> false))).containsExactly("alerts");
        }

        @Test
        void post_filters_do_not_widen_query_keys() {
            Set<String> derived = keys.fromFilters(
                    AlertFilter.count(2),
                    AlertFilter.time(Instant.EPOCH, Instant.now()),
                    AlertFilter.queryAlertType(5, ResourceType.NODE));
            assertThat(derived).containsExactly("alerts/Node/5");
        }

        @Test
        void malformed_post_filters_are_not_inspected() {
            Set<String> derived = keys.fromFilters(
                    AlertFilter.of(FilterKind.COUNT, "many"),
                    AlertFilter.of(null, "nothing"),
                    AlertFilter.queryResourceType(ResourceType.DRIVE));
            assertThat(derived).containsExactly("alerts/Drive");
        }

        @Test
        void malformed_query_filter_fails() {
            assertThatThrownBy(() -> keys.fromFilters(AlertFilter.of(FilterKind.QUERY_ALERT_TYPE, ResourceType.VOLUME)))
                    .isInstanceOf(ValueShapeMismatchException.class);
            assertThatThrownBy(() -> keys.fromFilters(AlertFilter.of(FilterKind.QUERY_RESOURCE_TYPE, "Volume")))
                    .isInstanceOf(ValueShapeMismatchException.class);
        }
    }

    @Test
    void empty_resource_id_payload_fails_derivation() {
        AlertFilter filter = AlertFilter.of(FilterKind.QUERY_RESOURCE_ID, new ResourceKey(5, ResourceType.VOLUME, ""));
        assertThatThrownBy(() -> keys.fromFilters(filter)).isInstanceOf(ValueShapeMismatchException.class);
    }

    @Nested
    @DisplayName("properties")
    class Properties {
        private final Random random = new Random(42);

        private AlertFilter randomFilter() {
            ResourceType type = ResourceType.values()[random.nextInt(3)];
            long alertType = random.nextInt(3);
            String resourceId = "r" + random.nextInt(3);
            switch (random.nextInt(6)) {
                case 0:
                    return AlertFilter.queryResourceType(type);
                case 1:
                    return AlertFilter.queryAlertType(alertType, type);
                case 2:
                    return AlertFilter.queryResourceId(resourceId, type, alertType);
                case 3:
                    return AlertFilter.count(random.nextInt(3));
                case 4:
                    return AlertFilter.resourceId(resourceId);
                default:
                    return AlertFilter.alertType(alertType);
            }
        }

        private List<AlertFilter> randomFilters() {
            List<AlertFilter> filters = new ArrayList<>();
            int size = random.nextInt(6);
            for (int i = 0; i < size; i++) {
                filters.add(randomFilter());
            }
            return filters;
        }

        private List<Alert> allAlerts() {
            List<Alert> alerts = new ArrayList<>();
            for (int t = 0; t < 3; t++) {
                for (long a = 0; a < 3; a++) {
                    for (int r = 0; r < 3; r++) {
                        alerts.add(Alert.builder()
                                .resource(ResourceType.values()[t])
                                .alertType(a)
                                .resourceId("r" + r)
                                .build());
                    }
                }
            }
            return alerts;
        }

        @Test
        void result_does_not_depend_on_input_order() {
            for (int i = 0; i < 200; i++) {
                List<AlertFilter> filters = randomFilters();
                List<AlertFilter> shuffled = new ArrayList<>(filters);
                Collections.shuffle(shuffled, random);
                assertThat(keys.fromFilters(shuffled)).isEqualTo(keys.fromFilters(filters));
            }
        }

        @Test
        void no_key_is_an_ancestor_of_another() {
            for (int i = 0; i < 200; i++) {
                Set<String> derived = keys.fromFilters(randomFilters());
                for (String a : derived) {
                    for (String b : derived) {
                        assertThat(AlertKeys.isAncestor(a, b)).as("%s / %s", a, b).isFalse();
                    }
                }
            }
        }

        @Test
        void every_alert_passing_the_query_filters_lives_under_a_derived_key() {
            List<Alert> alerts = allAlerts();
            for (int i = 0; i < 200; i++) {
                List<AlertFilter> filters = randomFilters();
                Filters queryFilters = Filters.of(Filters.of(filters).queryFilters());
                Set<String> derived = keys.fromFilters(filters);
                for (Alert alert : alerts) {
                    if (!queryFilters.matchAll(alert)) {
                        continue;
                    }
                    String fullKey = keys.keyOf(alert);
                    assertThat(derived.stream().anyMatch(k -> AlertKeys.isAncestor(k, fullKey)))
                            .as("%s under %s", fullKey, derived)
                            .isTrue();
                }
            }
        }
    }
}
