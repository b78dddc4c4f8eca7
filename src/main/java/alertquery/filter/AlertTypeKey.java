package alertquery.filter;

import alertquery.model.ResourceType;
import lombok.NonNull;
import lombok.Value;

@Value
public class AlertTypeKey {
    long alertType;
    @NonNull
    ResourceType resourceType;
}
