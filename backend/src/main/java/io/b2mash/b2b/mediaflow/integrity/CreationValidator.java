package io.b2mash.b2b.mediaflow.integrity;

import io.b2mash.b2b.mediaflow.job.NewJob;
import io.b2mash.b2b.mediaflow.order.NewOrder;
import io.b2mash.b2b.mediaflow.persistence.EntityStore;
import io.b2mash.b2b.mediaflow.upload.NewEditorUpload;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Preventive checks run before jobs, orders and uploads are created. */
@Component
public class CreationValidator {

  private final EntityStore store;

  public CreationValidator(EntityStore store) {
    this.store = store;
  }

  public ValidationResult validateJobCreation(NewJob job) {
    var errors = new ArrayList<String>();
    requireText(job.partnerId(), "partnerId", errors);
    requireText(job.address(), "address", errors);
    if (job.customerId() != null) {
      checkCustomer(job.customerId(), job.partnerId(), errors);
    }
    if (job.jobId() != null
        && !job.jobId().isBlank()
        && store.findJobByPublicId(job.jobId()).isPresent()) {
      errors.add("Job id " + job.jobId() + " is already in use");
    }
    return ValidationResult.of(errors);
  }

  public ValidationResult validateOrderCreation(NewOrder order) {
    var errors = new ArrayList<String>();
    requireText(order.partnerId(), "partnerId", errors);
    if (order.jobId() == null) {
      errors.add("jobId is required");
    } else {
      var job = store.findJob(order.jobId());
      if (job.isEmpty()) {
        errors.add("Job not found");
      } else {
        if (order.partnerId() != null && !order.partnerId().equals(job.get().getPartnerId())) {
          errors.add("Job belongs to another tenant");
        }
        if (order.customerId() != null
            && job.get().getCustomerId() != null
            && !order.customerId().equals(job.get().getCustomerId())) {
          errors.add("Order customer does not match job customer");
        }
      }
    }
    if (order.customerId() != null) {
      checkCustomer(order.customerId(), order.partnerId(), errors);
    }
    if (order.maxRevisionRounds() != null && order.maxRevisionRounds() < 0) {
      errors.add("maxRevisionRounds must not be negative");
    }
    return ValidationResult.of(errors);
  }

  public ValidationResult validateEditorUpload(NewEditorUpload upload) {
    var errors = new ArrayList<String>();
    requireText(upload.editorId(), "editorId", errors);
    requireText(upload.fileName(), "fileName", errors);
    requireText(upload.storagePath(), "storagePath", errors);
    if (upload.jobId() == null) {
      errors.add("jobId is required");
    } else if (store.findJob(upload.jobId()).isEmpty()) {
      errors.add("Job not found");
    }
    if (upload.orderId() != null) {
      var order = store.findOrder(upload.orderId());
      if (order.isEmpty()) {
        errors.add("Order not found");
      } else if (!Objects.equals(order.get().getJobId(), upload.jobId())) {
        errors.add("Order " + order.get().getOrderNumber() + " does not belong to this job");
      }
    }
    return ValidationResult.of(errors);
  }

  private void checkCustomer(UUID customerId, String partnerId, List<String> errors) {
    var customer = store.findCustomer(customerId);
    if (customer.isEmpty()) {
      errors.add("Customer not found");
    } else if (partnerId != null && !partnerId.equals(customer.get().getPartnerId())) {
      errors.add("Customer belongs to another tenant");
    }
  }

  private static void requireText(String value, String field, List<String> errors) {
    if (value == null || value.isBlank()) {
      errors.add(field + " is required");
    }
  }
}
