package io.b2mash.b2b.mediaflow.integrity;

public record RepairResult(boolean success, String message) {

  static RepairResult succeeded(String message) {
    return new RepairResult(true, message);
  }

  static RepairResult failed(String message) {
    return new RepairResult(false, message);
  }
}
