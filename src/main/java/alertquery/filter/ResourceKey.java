package alertquery.filter;

import alertquery.model.ResourceType;
import lombok.NonNull;
import lombok.Value;

@Value
public class ResourceKey {
    long alertType;
    @NonNull
    ResourceType resourceType;
    @NonNull
    String resourceId;
}
