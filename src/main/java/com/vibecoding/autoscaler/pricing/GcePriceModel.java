package com.vibecoding.autoscaler.pricing;

import com.vibecoding.autoscaler.util.NodeLabels;
import com.vibecoding.autoscaler.util.Quantities;
import com.vibecoding.autoscaler.util.ResourceNames;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ResourceRequirements;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * GCE 가격표 기반 가격 모델
 *
 * 노드 가격 결정 순서:
 * - 인스턴스 타입 전체 가격표 (preemptible/spot 노드는 preemptible 가격표)
 * - 가격표에 없으면 capacity 기반 CPU+메모리 단가 계산 후 preemptible 할인 적용
 * - GPU 는 GPU 타입별 가격, 없으면 기본 GPU 가격
 * 디스크(SSD 등)는 가격에 포함하지 않는다.
 */
@Service
@RequiredArgsConstructor
public class GcePriceModel implements PriceModel {

    private static final Logger log = LoggerFactory.getLogger(GcePriceModel.class);

    private static final double BYTES_PER_GIB = 1024.0 * 1024.0 * 1024.0;

    private final PriceCatalog priceCatalog;

    @Override
    public double nodePrice(Node node, Instant startTime, Instant endTime) {
        double hours = getHours(startTime, endTime);
        boolean preemptible = NodeLabels.hasPreemptiblePricing(node);
        Map<String, String> labels = NodeLabels.labelsOf(node);
        Optional<String> instanceType = NodeLabels.instanceType(labels);
        Map<String, Quantity> capacity = capacityOf(node);

        double price = 0.0;
        boolean basePriceFound = false;

        // 인스턴스 전체 가격
        if (instanceType.isPresent()) {
            Map<String, Double> priceMap = preemptible
                    ? priceCatalog.getPreemptibleInstancePrices()
                    : priceCatalog.getInstancePrices();
            OptionalDouble basePricePerHour = PriceLookup.find(instanceType.get(), priceMap);
            if (basePricePerHour.isPresent()) {
                price = basePricePerHour.getAsDouble() * hours;
                basePriceFound = true;
            } else {
                log.warn("Pricing information not found for instance type {}; will fallback to default pricing",
                        instanceType.get());
            }
        }

        if (!basePriceFound) {
            String machineType = instanceType.orElse("");
            price = getBasePrice(capacity, machineType, hours) * getPreemptibleDiscount(preemptible, machineType);
        }

        // GPU
        long gpuMilli = Quantities.milliValue(capacity, ResourceNames.NVIDIA_GPU);
        if (gpuMilli != 0) {
            double gpuPrice = priceCatalog.getBaseGpuPricePerHour();
            String gpuType = labels.get(NodeLabels.GKE_ACCELERATOR);
            if (gpuType != null) {
                Map<String, Double> priceMap = preemptible
                        ? priceCatalog.getPreemptibleGpuPrices()
                        : priceCatalog.getGpuPrices();
                OptionalDouble typedPrice = PriceLookup.find(gpuType, priceMap);
                if (typedPrice.isPresent()) {
                    gpuPrice = typedPrice.getAsDouble();
                } else {
                    log.warn("Pricing information not found for GPU type {}; will fallback to default pricing", gpuType);
                }
            }
            price += gpuMilli / 1000.0 * gpuPrice * hours;
        }

        // TODO: price local SSDs once the catalog carries per-GB disk prices
        return price;
    }

    @Override
    public double podPrice(Pod pod, Instant startTime, Instant endTime) {
        double hours = getHours(startTime, endTime);
        double price = 0.0;
        if (pod.getSpec() == null || pod.getSpec().getContainers() == null) {
            return price;
        }
        for (Container container : pod.getSpec().getContainers()) {
            Map<String, Quantity> requests = requestsOf(container);
            price += getBasePrice(requests, "", hours);
            price += getAdditionalPrice(requests, hours);
        }
        return price;
    }

    /**
     * preemptible 노드의 할인 계수 (일반 노드는 1.0)
     */
    double getPreemptibleDiscount(boolean preemptible, String instanceType) {
        if (!preemptible) {
            return 1.0;
        }
        Map<String, Double> discountMap = isInstanceCustom(instanceType)
                ? priceCatalog.getCustomPreemptibleDiscount()
                : priceCatalog.getPredefinedPreemptibleDiscount();
        return PriceLookup.resolve(getInstanceFamily(instanceType),
                priceCatalog.getDefaultPreemptibleDiscount(), discountMap);
    }

    /**
     * CPU + 메모리 단가 기반 가격. 패밀리 단가가 없으면 기본 단가를 사용한다.
     */
    double getBasePrice(Map<String, Quantity> resources, String instanceType, double hours) {
        if (resources.isEmpty()) {
            return 0.0;
        }
        String instanceFamily = getInstanceFamily(instanceType);
        boolean custom = isInstanceCustom(instanceType);

        double cpuPrice = PriceLookup.resolve(instanceFamily, priceCatalog.getBaseCpuPricePerHour(),
                custom ? priceCatalog.getCustomCpuPricePerHour() : priceCatalog.getPredefinedCpuPricePerHour());
        double memPrice = PriceLookup.resolve(instanceFamily, priceCatalog.getBaseMemoryPricePerHourPerGb(),
                custom ? priceCatalog.getCustomMemoryPricePerHourPerGb() : priceCatalog.getPredefinedMemoryPricePerHourPerGb());

        double price = Quantities.milliValue(resources, ResourceNames.CPU) / 1000.0 * cpuPrice * hours;
        price += Quantities.value(resources, ResourceNames.MEMORY) / BYTES_PER_GIB * memPrice * hours;
        return price;
    }

    /**
     * GPU 처럼 CPU/메모리 외 리소스 가격 (항상 기본 GPU 단가)
     */
    double getAdditionalPrice(Map<String, Quantity> resources, double hours) {
        if (resources.isEmpty()) {
            return 0.0;
        }
        long gpuMilli = Quantities.milliValue(resources, ResourceNames.NVIDIA_GPU);
        return gpuMilli / 1000.0 * priceCatalog.getBaseGpuPricePerHour() * hours;
    }

    /**
     * 분 단위로 올림한 뒤 시간으로 환산 (61분 → 61/60 시간)
     */
    static double getHours(Instant startTime, Instant endTime) {
        long nanos = Duration.between(startTime, endTime).toNanos();
        double minutes = Math.ceil((double) nanos / Duration.ofMinutes(1).toNanos());
        return minutes / 60.0;
    }

    static String getInstanceFamily(String instanceType) {
        if (instanceType == null) {
            return "";
        }
        int dash = instanceType.indexOf('-');
        return dash < 0 ? instanceType : instanceType.substring(0, dash);
    }

    static boolean isInstanceCustom(String instanceType) {
        return instanceType != null && instanceType.contains("custom");
    }

    private static Map<String, Quantity> capacityOf(Node node) {
        if (node.getStatus() == null || node.getStatus().getCapacity() == null) {
            return Collections.emptyMap();
        }
        return node.getStatus().getCapacity();
    }

    private static Map<String, Quantity> requestsOf(Container container) {
        ResourceRequirements resources = container.getResources();
        if (resources == null || resources.getRequests() == null) {
            return Collections.emptyMap();
        }
        return resources.getRequests();
    }
}
