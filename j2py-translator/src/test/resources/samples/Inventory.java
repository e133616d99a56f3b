// Fixed-capacity inventory.
public class Inventory {
    private String[] names;
    private int[] counts;
    private int size;

    public Inventory(int capacity) {
        names = new String[capacity];
        counts = new int[capacity];
    }

    public void add(String name, int count) {
        names[size] = name;
        counts[size] = count;
        size++;
    }

    public int total() {
        int sum = 0;
        for (int c : counts) {
            sum += c;
        }
        return sum;
    }

    public String describe(int index) {
        String kind;
        switch (counts[index]) {
            case 0:
                kind = "none";
                break;
            case 1:
                kind = "single";
                break;
            default:
                kind = "many";
        }
        return names[index] + ": " + kind;
    }

    public static void main(String[] args) {
        Inventory inv = new Inventory(3);
        inv.add("apple", 2);
        inv.add("pear", 1);
        inv.add("fig", 0);
        int i = 0;
        while (i < inv.size) {
            System.out.println(inv.describe(i));
            i++;
        }
        System.out.println("total " + inv.total());
        int countdown = 3;
        do {
            countdown--;
        } while (countdown > 0);
        System.out.println(countdown == 0 ? "done" : "not done");
    }
}
